package com.example.slidetranslate.deck;

import org.apache.poi.xslf.usermodel.XSLFShape;

/**
 * Picture, connector, chart or any other shape without translatable text. Only its
 * box matters, as an obstacle when neighbouring text boxes are widened.
 */
public class OpaqueShape extends DeckShape {

    OpaqueShape(XSLFShape shape) {
        super(shape);
    }

    @Override
    public Kind getKind() {
        return Kind.OPAQUE;
    }
}
