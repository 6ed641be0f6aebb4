package org.sirena.requirement.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A design artifact that requirements are traced to, such as a document or test. */
public class RequirementElement {
    private final String name;
    private String type;
    private String docRef;
    private String style;
    private final List<String> classes = new ArrayList<>();

    public RequirementElement(String name) {
        this.name = name;
    }

    public String getName()          { return name; }
    public String getType()          { return type; }
    public String getDocRef()        { return docRef; }
    public String getStyle()         { return style; }
    public List<String> getClasses() { return Collections.unmodifiableList(classes); }

    public void setType(String type)     { this.type = type; }
    public void setDocRef(String docRef) { this.docRef = docRef; }
    public void setStyle(String style)   { this.style = style; }

    public void addClass(String cls) {
        if (cls != null && !cls.isBlank() && !classes.contains(cls)) {
            classes.add(cls);
        }
    }
}
