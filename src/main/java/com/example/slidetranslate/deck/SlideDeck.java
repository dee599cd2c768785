package com.example.slidetranslate.deck;

import org.apache.poi.util.Units;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * An open presentation.
 */
public class SlideDeck implements Closeable {

    private final XMLSlideShow slideShow;

    public SlideDeck(XMLSlideShow slideShow) {
        this.slideShow = slideShow;
    }

    public List<DeckSlide> getSlides() {
        List<DeckSlide> slides = new ArrayList<>();
        List<XSLFSlide> source = slideShow.getSlides();
        for (int i = 0; i < source.size(); i++) {
            slides.add(new DeckSlide(source.get(i), i + 1));
        }
        return slides;
    }

    public long getSlideWidth() {
        return Units.toEMU(slideShow.getPageSize().getWidth());
    }

    public long getSlideHeight() {
        return Units.toEMU(slideShow.getPageSize().getHeight());
    }

    public void write(OutputStream out) throws IOException {
        slideShow.write(out);
    }

    @Override
    public void close() throws IOException {
        slideShow.close();
    }
}
