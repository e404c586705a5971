package genko;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders exported manuscript pages into a spreadsheet workbook, one sheet per page.
 * Sheet layout:
 *   sheet "Page N", rows x cols cells
 *   page column c  ->  sheet column (cols - 1 - c), so the first column is the rightmost one
 *   cell value     ->  the vertical presentation text of the unit (TCY pairs stay two digits)
 * Empty cells are created blank so every page carries the full grid.
 */
class WorkbookExporter {

    static final String SHEET_PREFIX = "Page ";

    static Workbook toWorkbook(ManuscriptExporter.ExportDocument doc) {
        ManuscriptGrid grid = doc.grid();
        int rows = grid.rows();
        int cols = grid.cols();

        Workbook wb = new XSSFWorkbook();
        CellStyle cellStyle = createCellStyle(wb);

        for (ManuscriptExporter.Page page : doc.pages()) {
            Sheet sheet = wb.createSheet(SHEET_PREFIX + page.number());

            int r = 0;
            while (r < rows) {
                Row row = sheet.createRow(r);
                row.setHeightInPoints(18f);
                int c = 0;
                while (c < cols) {
                    Cell cell = row.createCell(c, CellType.BLANK);
                    cell.setCellStyle(cellStyle);
                    c = c + 1;
                }
                r = r + 1;
            }
            int c = 0;
            while (c < cols) {
                sheet.setColumnWidth(c, 5 * 256);
                c = c + 1;
            }

            for (LayoutEngine.Unit unit : page.units()) {
                int sheetCol = cols - 1 - unit.columnInPage(cols);
                Cell cell = sheet.getRow(unit.row()).getCell(sheetCol);
                cell.setCellValue(VerticalGlyphs.displayText(unit));
            }
        }
        if (wb.getNumberOfSheets() == 0) {
            wb.createSheet(SHEET_PREFIX + 1);
        }
        return wb;
    }

    static void writeWorkbook(Path target, ManuscriptExporter.ExportDocument doc) throws IOException {
        Workbook wb = toWorkbook(doc);
        try (OutputStream out = Files.newOutputStream(target)) {
            wb.write(out);
            DebugLog.log("workbook", "wrote %d page(s) to %s", doc.totalPages(), target);
        } catch (Exception ex) {
            throw new IOException("Failed to write workbook: " + ex.getMessage(), ex);
        } finally {
            try {
                wb.close();
            } catch (IOException ex) {
                DebugLog.log("workbook", "close failed: %s", ex.getMessage());
            }
        }
    }

    /**
     * Reads one page back as a rows x cols array in page coordinates
     * ([row][columnInPage], column 0 is the rightmost). Blank cells are empty strings.
     */
    static String[][] readPage(Path source, int pageIndex, ManuscriptGrid grid) throws IOException {
        try (InputStream in = Files.newInputStream(source);
             Workbook wb = WorkbookFactory.create(in)) {
            return readPage(wb, pageIndex, grid);
        } catch (IOException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IOException("Failed to read workbook: " + ex.getMessage(), ex);
        }
    }

    static String[][] readPage(Workbook wb, int pageIndex, ManuscriptGrid grid) {
        int rows = grid.rows();
        int cols = grid.cols();
        String[][] out = new String[rows][cols];
        Sheet sheet = wb.getSheetAt(pageIndex);
        DataFormatter fmt = new DataFormatter();

        int r = 0;
        while (r < rows) {
            Row row = sheet.getRow(r);
            int c = 0;
            while (c < cols) {
                Cell cell = row == null ? null : row.getCell(cols - 1 - c);
                String val = cell == null ? "" : fmt.formatCellValue(cell);
                out[r][c] = val == null ? "" : val;
                c = c + 1;
            }
            r = r + 1;
        }
        return out;
    }

    private static CellStyle createCellStyle(Workbook wb) {
        CellStyle style = wb.createCellStyle();
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
        return style;
    }
}
