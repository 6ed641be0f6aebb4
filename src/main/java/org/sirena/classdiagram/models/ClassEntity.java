package org.sirena.classdiagram.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A class box. The id is the namespace-qualified name; members accumulate across
 * every statement that mentions the class.
 */
public class ClassEntity {
    private final String id;
    private String label;
    private String generic;
    private String stereotype;
    private String namespace;
    private final List<ClassAttribute> attributes = new ArrayList<>();
    private final List<ClassMethod> methods = new ArrayList<>();
    private final List<String> cssClasses = new ArrayList<>();

    public ClassEntity(String id) {
        this.id = id;
        this.label = id;
    }

    public String getId()                     { return id; }
    public String getLabel()                  { return label; }
    public String getGeneric()                { return generic; }
    public String getStereotype()             { return stereotype; }
    public String getNamespace()              { return namespace; }
    public List<ClassAttribute> getAttributes() { return Collections.unmodifiableList(attributes); }
    public List<ClassMethod> getMethods()     { return Collections.unmodifiableList(methods); }
    public List<String> getCssClasses()       { return Collections.unmodifiableList(cssClasses); }

    public void setLabel(String label)           { this.label = label; }
    public void setGeneric(String generic)       { this.generic = generic; }
    public void setStereotype(String stereotype) { this.stereotype = stereotype; }
    public void setNamespace(String namespace)   { this.namespace = namespace; }

    public void addAttribute(ClassAttribute attribute) {
        attributes.add(attribute);
    }

    public void addMethod(ClassMethod method) {
        methods.add(method);
    }

    public void addCssClass(String cls) {
        if (!cssClasses.contains(cls)) {
            cssClasses.add(cls);
        }
    }

    @Override
    public String toString() {
        return "ClassEntity{id='" + id + "', attributes=" + attributes.size() + ", methods=" + methods.size() + "}";
    }
}
