package com.example.slidetranslate.deck;

import org.apache.poi.util.Units;
import org.apache.poi.xslf.usermodel.XSLFTextShape;

import java.awt.geom.Rectangle2D;

public class TextShape extends DeckShape {

    private final XSLFTextShape textShape;

    TextShape(XSLFTextShape textShape) {
        super(textShape);
        this.textShape = textShape;
    }

    @Override
    public Kind getKind() {
        return Kind.TEXT;
    }

    /**
     * Text frame of this shape, sized from the shape's current box.
     */
    public TextContainer getTextContainer() {
        return new TextContainer(textShape, getWidth(), getHeight());
    }

    public void setWidth(long widthEmu) {
        Rectangle2D anchor = anchor();
        if (anchor == null) {
            throw new IllegalStateException("Shape '" + getName() + "' has no anchor");
        }
        textShape.setAnchor(new Rectangle2D.Double(
            anchor.getX(), anchor.getY(), Units.toPoints(widthEmu), anchor.getHeight()));
    }
}
