package com.shellast.jackson;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.shellast.ast.*;
import com.shellast.jackson.mixins.NodeMixin;

import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the shell AST.
 *
 * This module handles:
 * - Polymorphic type handling via NodeMixin
 * - Positions written as {"line": .., "column": ..} without derived flags
 * - Picking the canonical constructor for single-component records
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.shellast", "shellast-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Command.class, NodeMixin.class);
        context.setMixInAnnotations(WordPart.class, NodeMixin.class);

        context.setMixInAnnotations(Pos.class, PosMixin.class);

        // A lone List component could otherwise be taken for a delegating creator
        context.setMixInAnnotations(Word.class, WordMixin.class);
        context.setMixInAnnotations(CallExpr.class, CallExprMixin.class);
    }

    // isKnown() is derived from line
    @JsonIgnoreProperties({"known"})
    private abstract static class PosMixin {
    }

    private abstract static class WordMixin {
        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        WordMixin(@JsonProperty("parts") List<WordPart> parts) {
        }
    }

    private abstract static class CallExprMixin {
        @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
        CallExprMixin(@JsonProperty("args") List<Word> args) {
        }
    }
}
