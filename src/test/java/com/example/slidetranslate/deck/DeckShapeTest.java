package com.example.slidetranslate.deck;

import org.apache.poi.util.Units;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.drawingml.x2006.main.CTTableCell;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeckShapeTest {

    @Test
    void wrapsEveryShapeIntoItsKind() throws IOException {
        try (XMLSlideShow show = new XMLSlideShow()) {
            XSLFSlide slide = show.createSlide();
            DeckFixtures.textBox(slide, 10, 20, 100, 50, "text");
            slide.createTable(1, 1);
            XSLFGroupShape group = slide.createGroup();
            DeckFixtures.textBox(group, 0, 0, 10, 10, "member");
            slide.createConnector();

            SlideDeck deck = DeckFixtures.deck(show);
            List<DeckShape> shapes = deck.getSlides().get(0).getShapes();

            assertThat(shapes).extracting(DeckShape::getKind).containsExactly(
                DeckShape.Kind.TEXT, DeckShape.Kind.TABLE, DeckShape.Kind.GROUP, DeckShape.Kind.OPAQUE);
            assertThat(shapes.get(0).getLeft()).isEqualTo(Units.toEMU(10));
            assertThat(shapes.get(0).getRight()).isEqualTo(Units.toEMU(110));
            assertThat(shapes.get(0).getBottom()).isEqualTo(Units.toEMU(70));
            assertThat(((GroupShape) shapes.get(2)).getChildren()).hasSize(1);
            assertThat(deck.getSlideWidth()).isEqualTo(Units.toEMU(720));
            assertThat(deck.getSlides().get(0).getNumber()).isEqualTo(1);
        }
    }

    @Test
    void textShapeWidthCanBeChanged() throws IOException {
        try (XMLSlideShow show = new XMLSlideShow()) {
            DeckFixtures.textBox(show.createSlide(), 10, 20, 100, 50, "text");
            TextShape shape = (TextShape) DeckFixtures.deck(show).getSlides().get(0).getShapes().get(0);

            shape.setWidth(Units.toEMU(250));

            assertThat(shape.getWidth()).isEqualTo(Units.toEMU(250));
            assertThat(shape.getLeft()).isEqualTo(Units.toEMU(10));
            assertThat(shape.getTextContainer().getAvailableWidth()).isEqualTo(Units.toEMU(250 - 14.4));
        }
    }

    @Test
    void tableCellsSkipMergedCellsAndSumSpans() throws IOException {
        try (XMLSlideShow show = new XMLSlideShow()) {
            XSLFTable table = show.createSlide().createTable(2, 2);
            table.setAnchor(new Rectangle2D.Double(0, 0, 300, 80));
            table.setColumnWidth(0, 100);
            table.setColumnWidth(1, 200);
            table.setRowHeight(0, 30);
            table.setRowHeight(1, 50);
            table.getCell(0, 0).setText("spanning");
            CTTableCell spanning = (CTTableCell) table.getCell(0, 0).getXmlObject();
            spanning.setGridSpan(2);
            ((CTTableCell) table.getCell(0, 1).getXmlObject()).setHMerge(true);
            table.getCell(1, 0).setText("a");
            table.getCell(1, 1).setText("b");

            TableShape shape = (TableShape) DeckFixtures.deck(show).getSlides().get(0).getShapes().get(0);
            List<TextContainer> cells = shape.getCells();

            assertThat(cells).hasSize(3);
            assertThat(cells.get(0).getBoxWidth()).isEqualTo(Units.toEMU(300));
            assertThat(cells.get(0).getBoxHeight()).isEqualTo(Units.toEMU(30));
            assertThat(cells.get(2).getBoxWidth()).isEqualTo(Units.toEMU(200));
            assertThat(cells.get(2).getBoxHeight()).isEqualTo(Units.toEMU(50));
        }
    }
}
