package com.example.slidetranslate.deck;

import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFShape;

import java.util.ArrayList;
import java.util.List;

public class GroupShape extends DeckShape {

    private final XSLFGroupShape group;

    GroupShape(XSLFGroupShape group) {
        super(group);
        this.group = group;
    }

    @Override
    public Kind getKind() {
        return Kind.GROUP;
    }

    public List<DeckShape> getChildren() {
        List<DeckShape> children = new ArrayList<>();
        for (XSLFShape child : group.getShapes()) {
            children.add(DeckShape.wrap(child));
        }
        return children;
    }
}
