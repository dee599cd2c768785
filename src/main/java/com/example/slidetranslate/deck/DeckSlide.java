package com.example.slidetranslate.deck;

import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;

import java.util.ArrayList;
import java.util.List;

public class DeckSlide {

    private final XSLFSlide slide;
    private final int number;

    DeckSlide(XSLFSlide slide, int number) {
        this.slide = slide;
        this.number = number;
    }

    /**
     * 1-based position of the slide in the deck.
     */
    public int getNumber() {
        return number;
    }

    public List<DeckShape> getShapes() {
        List<DeckShape> shapes = new ArrayList<>();
        for (XSLFShape shape : slide.getShapes()) {
            shapes.add(DeckShape.wrap(shape));
        }
        return shapes;
    }
}
