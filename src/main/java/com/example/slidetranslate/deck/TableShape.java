package com.example.slidetranslate.deck;

import org.apache.poi.util.Units;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTableCell;

import java.util.ArrayList;
import java.util.List;

public class TableShape extends DeckShape {

    private final XSLFTable table;

    TableShape(XSLFTable table) {
        super(table);
        this.table = table;
    }

    @Override
    public Kind getKind() {
        return Kind.TABLE;
    }

    /**
     * Text frames of all cells in row-major order. Cells hidden by a horizontal or
     * vertical merge are left out; a spanning cell is sized over all columns and rows
     * it covers.
     */
    public List<TextContainer> getCells() {
        List<TextContainer> cells = new ArrayList<>();
        List<XSLFTableRow> rows = table.getRows();
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            List<XSLFTableCell> rowCells = rows.get(rowIndex).getCells();
            for (int colIndex = 0; colIndex < rowCells.size(); colIndex++) {
                XSLFTableCell cell = rowCells.get(colIndex);
                CTTableCell xml = (CTTableCell) cell.getXmlObject();
                if ((xml.isSetHMerge() && xml.getHMerge()) || (xml.isSetVMerge() && xml.getVMerge())) {
                    continue;
                }
                int gridSpan = xml.isSetGridSpan() ? Math.max(1, xml.getGridSpan()) : 1;
                int rowSpan = xml.isSetRowSpan() ? Math.max(1, xml.getRowSpan()) : 1;
                cells.add(new TextContainer(cell,
                    spanWidth(colIndex, gridSpan),
                    spanHeight(rowIndex, rowSpan)));
            }
        }
        return cells;
    }

    private long spanWidth(int firstColumn, int span) {
        double points = 0;
        int columns = table.getNumberOfColumns();
        for (int col = firstColumn; col < Math.min(columns, firstColumn + span); col++) {
            points += table.getColumnWidth(col);
        }
        return Units.toEMU(points);
    }

    private long spanHeight(int firstRow, int span) {
        double points = 0;
        int rows = table.getNumberOfRows();
        for (int row = firstRow; row < Math.min(rows, firstRow + span); row++) {
            points += table.getRowHeight(row);
        }
        return Units.toEMU(points);
    }
}
