package com.logprog.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.logprog.ast.*;

/**
 * Jackson module that configures serialization/deserialization for the AST records.
 *
 * This module handles:
 * - Polymorphic type handling: the "type" property carries {@link Node#type()}
 * - Registration of every permitted {@link Node} variant as a named subtype
 * - Creator binding for records whose shape Jackson cannot infer on its own
 *
 * The AST classes themselves stay free of Jackson annotations; everything is
 * attached through mixins.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.logprog", "quill-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        // Builtin.args is declared as ExpressionList rather than Node, so give the
        // concrete type the type-id handling explicitly
        context.setMixInAnnotations(ExpressionList.class, NodeMixin.class);
        context.setMixInAnnotations(StatementList.class, NodeMixin.class);

        // Next has a no-arg convenience constructor next to its canonical one
        context.setMixInAnnotations(Next.class, NextMixin.class);

        context.registerSubtypes(subtypes());
    }

    /**
     * One named subtype per permitted variant, named after {@link Node#type()}.
     */
    static NamedType[] subtypes() {
        Class<?>[] variants = Node.class.getPermittedSubclasses();
        NamedType[] types = new NamedType[variants.length];
        for (int i = 0; i < variants.length; i++) {
            types[i] = new NamedType(variants[i], variants[i].getSimpleName());
        }
        return types;
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    private interface NodeMixin {
    }

    private abstract static class NextMixin {
        @JsonCreator
        NextMixin(@JsonProperty("loc") SourceLocation loc) {
        }
    }
}
