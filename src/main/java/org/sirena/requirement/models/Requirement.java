package org.sirena.requirement.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Requirement {
    private final String name;
    private String type = "requirement";
    private String id;
    private String text;
    private String risk;
    private String verifyMethod;
    private String style;
    private final List<String> classes = new ArrayList<>();

    public Requirement(String name) {
        this.name = name;
    }

    public String getName()          { return name; }
    public String getType()          { return type; }
    public String getId()            { return id; }
    public String getText()          { return text; }
    public String getRisk()          { return risk; }
    public String getVerifyMethod()  { return verifyMethod; }
    public String getStyle()         { return style; }
    public List<String> getClasses() { return Collections.unmodifiableList(classes); }

    public void setType(String type)                 { this.type = type; }
    public void setId(String id)                     { this.id = id; }
    public void setText(String text)                 { this.text = text; }
    public void setRisk(String risk)                 { this.risk = risk; }
    public void setVerifyMethod(String verifyMethod) { this.verifyMethod = verifyMethod; }
    public void setStyle(String style)               { this.style = style; }

    public void addClass(String cls) {
        if (cls != null && !cls.isBlank() && !classes.contains(cls)) {
            classes.add(cls);
        }
    }
}
