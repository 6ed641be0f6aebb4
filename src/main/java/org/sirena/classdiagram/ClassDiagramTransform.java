package org.sirena.classdiagram;

import org.sirena.classdiagram.models.ClassAttribute;
import org.sirena.classdiagram.models.ClassDiagram;
import org.sirena.classdiagram.models.ClassEntity;
import org.sirena.classdiagram.models.ClassInteraction;
import org.sirena.classdiagram.models.ClassMethod;
import org.sirena.classdiagram.models.ClassNamespace;
import org.sirena.classdiagram.models.ClassNote;
import org.sirena.classdiagram.models.ClassRelationship;
import org.sirena.diagram.ContextStack;
import org.sirena.diagram.EntityRegistry;
import org.sirena.diagram.Transform;
import org.sirena.grammar.CstNode.Captures;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ClassDiagramTransform implements Transform<ClassDiagram> {

    private static final Map<String, String> VISIBILITY = Map.of(
            "+", "public",
            "-", "private",
            "#", "protected",
            "~", "package");

    private final EntityRegistry<ClassEntity> classes = new EntityRegistry<>(ClassEntity::new);
    private final List<ClassRelationship> relationships = new ArrayList<>();
    private final Map<String, List<String>> namespaces = new LinkedHashMap<>();
    private final ContextStack<String> namespaceScope = new ContextStack<>();
    private final List<ClassInteraction> interactions = new ArrayList<>();
    private final List<ClassNote> notes = new ArrayList<>();
    private final Map<String, String> classDefs = new LinkedHashMap<>();
    private String direction = "TB";
    private String title;
    private String accTitle;
    private String accDescription;

    @Override
    public ClassDiagram apply(Captures tree) {
        tree.records("statements").forEach(this::statement);
        List<ClassNamespace> builtNamespaces = new ArrayList<>();
        namespaces.forEach((name, ids) -> builtNamespaces.add(new ClassNamespace(name, ids)));
        return new ClassDiagram(direction, classes.values(), relationships, builtNamespaces,
                interactions, notes, classDefs, title, accTitle, accDescription);
    }

    private void statement(Captures stmt) {
        if (stmt.has("namespace")) {
            String name = unquote(stmt.text("namespace"));
            namespaces.computeIfAbsent(name, k -> new ArrayList<>());
            namespaceScope.within(name, () -> stmt.records("body").forEach(this::statement));
        } else if (stmt.has("direction")) {
            direction = stmt.text("direction");
        } else if (stmt.has("class")) {
            declare(stmt);
        } else if (stmt.has("stereotype_of")) {
            touch(stmt.text("stereotype_of")).setStereotype(stmt.text("stereotype"));
        } else if (stmt.has("from")) {
            relationship(stmt);
        } else if (stmt.has("member_of")) {
            member(touch(stmt.text("member_of")), stmt);
        } else if (stmt.has("note")) {
            String target = stmt.has("note_for") ? touch(stmt.text("note_for")).getId() : null;
            notes.add(new ClassNote(target, stmt.text("note")));
        } else if (stmt.has("link")) {
            interaction(stmt.text("link"), "link", stmt.text("href"), stmt);
        } else if (stmt.has("callback_of")) {
            interaction(stmt.text("callback_of"), "callback", stmt.text("callback"), stmt);
        } else if (stmt.has("click")) {
            if (stmt.has("href")) {
                interaction(stmt.text("click"), "link", stmt.text("href"), stmt);
            } else {
                interaction(stmt.text("click"), "callback", stmt.text("callback"), stmt);
            }
        } else if (stmt.has("css_targets")) {
            for (String id : stmt.text("css_targets").split(",")) {
                touch(id.trim()).addCssClass(stmt.text("css_class"));
            }
        } else if (stmt.has("class_def")) {
            classDefs.put(stmt.text("class_def"), stmt.text("css"));
        } else if (stmt.has("acc_title")) {
            accTitle = stmt.text("acc_title");
        } else if (stmt.has("acc_descr")) {
            accDescription = stmt.text("acc_descr");
        } else if (stmt.has("title")) {
            title = stmt.text("title");
        }
    }

    private void declare(Captures stmt) {
        ClassEntity entity = touch(stmt.text("class"));
        if (stmt.has("generic")) {
            entity.setGeneric(stmt.text("generic"));
        }
        entity.setLabel(EntityRegistry.merge(entity.getLabel(), stmt.optText("class_label")));
        entity.setStereotype(EntityRegistry.merge(entity.getStereotype(), stmt.optText("stereotype")));
        if (stmt.has("css_class")) {
            entity.addCssClass(stmt.text("css_class"));
        }
        for (Captures member : stmt.records("members")) {
            member(entity, member);
        }
    }

    private void relationship(Captures stmt) {
        String from = touch(stmt.text("from")).getId();
        String to = touch(stmt.text("to")).getId();
        String fromCard = stmt.has("from_card") ? stmt.text("from_card") : null;
        String toCard = stmt.has("to_card") ? stmt.text("to_card") : null;
        boolean reversed = stmt.has("reversed");
        relationships.add(ClassRelationship.builder()
                .sourceId(reversed ? to : from)
                .targetId(reversed ? from : to)
                .type(stmt.text("relation"))
                .operator(stmt.text("operator"))
                .label(stmt.optText("label"))
                .sourceCardinality(reversed ? toCard : fromCard)
                .targetCardinality(reversed ? fromCard : toCard)
                .build());
    }

    private void member(ClassEntity entity, Captures member) {
        String visibility = VISIBILITY.getOrDefault(member.optText("visibility"), "public");
        if (member.has("method")) {
            String classifier = member.optText("classifier");
            entity.addMethod(ClassMethod.builder()
                    .name(member.text("method"))
                    .parameters(member.optText("params"))
                    .returnType(member.optText("return_type"))
                    .visibility(visibility)
                    .isStatic(classifier.equals("$"))
                    .isAbstract(classifier.equals("*"))
                    .build());
            return;
        }
        String text = member.text("attribute");
        boolean isStatic = text.endsWith("$");
        if (isStatic) {
            text = text.substring(0, text.length() - 1).trim();
        }
        String name;
        String type;
        int colon = text.indexOf(':');
        int space = text.lastIndexOf(' ');
        if (colon >= 0) {
            name = text.substring(0, colon).trim();
            type = text.substring(colon + 1).trim();
        } else if (space >= 0) {
            type = text.substring(0, space).trim();
            name = text.substring(space + 1).trim();
        } else {
            name = text;
            type = "";
        }
        entity.addAttribute(new ClassAttribute(name, type, visibility, isStatic));
    }

    private void interaction(String classRef, String kind, String target, Captures stmt) {
        String id = touch(classRef).getId();
        interactions.add(new ClassInteraction(id, kind, target, stmt.has("tooltip") ? stmt.text("tooltip") : null));
    }

    /** Finds or creates the class, qualifying bare names with the enclosing namespace. */
    private ClassEntity touch(String name) {
        String id = unquote(name);
        String ns = namespaceScope.current().orElse(null);
        if (ns != null && !id.contains(".")) {
            id = ns + "." + id;
        }
        boolean known = classes.contains(id);
        ClassEntity entity = classes.findOrCreate(id);
        if (!known && ns != null) {
            entity.setNamespace(ns);
            namespaces.get(ns).add(id);
        }
        return entity;
    }

    private static String unquote(String name) {
        if (name.length() >= 2 && name.startsWith("`") && name.endsWith("`")) {
            return name.substring(1, name.length() - 1);
        }
        return name;
    }
}
