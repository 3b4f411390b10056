package com.gdformatter.plugins.gdscript.reorder;

import java.util.Set;

/**
 * Class member categories in the order the GDScript style guide lists them.
 * Declaration order of the constants is the sort order.
 */
public enum MemberKind {
    TOOL,
    ICON,
    STATIC_UNLOAD,
    CLASS_NAME,
    EXTENDS,
    DOC_COMMENT,
    SIGNAL,
    ENUM,
    CONST,
    STATIC_VAR,
    EXPORT_VAR,
    VAR,
    ONREADY_VAR,
    STATIC_INIT,
    STATIC_METHOD,
    VIRTUAL_INIT,
    VIRTUAL_ENTER_TREE,
    VIRTUAL_READY,
    VIRTUAL_PROCESS,
    VIRTUAL_PHYSICS_PROCESS,
    VIRTUAL_OTHER,
    OVERRIDDEN_CUSTOM_METHOD,
    METHOD,
    INNER_CLASS;

    private static final Set<String> OTHER_VIRTUALS = Set.of(
            "_exit_tree", "_input", "_unhandled_input", "_notification", "_draw", "_gui_input",
            "_unhandled_key_input", "_shortcut_input", "_get_configuration_warnings",
            "_get_configuration_warning");

    /**
     * File-level annotations, class_name and extends sit together without blank lines.
     */
    public boolean isHeader() {
        return this == TOOL || this == ICON || this == STATIC_UNLOAD || this == CLASS_NAME || this == EXTENDS;
    }

    public boolean isFunctionLike() {
        return compareTo(STATIC_INIT) >= 0;
    }

    public static MemberKind ofFunction(String name, boolean isStatic) {
        if (isStatic) {
            return name.equals("_static_init") ? STATIC_INIT : STATIC_METHOD;
        }
        switch (name) {
            case "_init":
                return VIRTUAL_INIT;
            case "_enter_tree":
                return VIRTUAL_ENTER_TREE;
            case "_ready":
                return VIRTUAL_READY;
            case "_process":
                return VIRTUAL_PROCESS;
            case "_physics_process":
                return VIRTUAL_PHYSICS_PROCESS;
            default:
                if (OTHER_VIRTUALS.contains(name)) {
                    return VIRTUAL_OTHER;
                }
                return name.startsWith("_") ? OVERRIDDEN_CUSTOM_METHOD : METHOD;
        }
    }

    /**
     * Variable kind from its annotation names and modifiers; onready wins over
     * export, which wins over static.
     */
    public static MemberKind ofVariable(Iterable<String> modifiers) {
        boolean export = false;
        boolean isStatic = false;
        for (String modifier : modifiers) {
            if (modifier.equals("onready")) {
                return ONREADY_VAR;
            }
            export |= isExportAnnotation(modifier);
            isStatic |= modifier.equals("static");
        }
        if (export) {
            return EXPORT_VAR;
        }
        return isStatic ? STATIC_VAR : VAR;
    }

    /**
     * Kind of a standalone file-level annotation, or null for any other annotation.
     */
    public static MemberKind ofFileAnnotation(String name) {
        return switch (name) {
            case "tool" -> TOOL;
            case "icon" -> ICON;
            case "static_unload" -> STATIC_UNLOAD;
            default -> null;
        };
    }

    public static boolean isExportAnnotation(String name) {
        return name.equals("export") || name.startsWith("export_");
    }

    public static boolean isSectionAnnotation(String name) {
        return name.equals("export_category") || name.equals("export_group") || name.equals("export_subgroup");
    }
}
