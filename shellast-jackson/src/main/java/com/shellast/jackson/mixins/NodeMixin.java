package com.shellast.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.shellast.ast.*;

/**
 * Polymorphic type handling for every node: the JSON "type" property holds
 * the node's simple class name, which is also what {@link Node#type()} returns.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = File.class, name = "File"),
    @JsonSubTypes.Type(value = Stmt.class, name = "Stmt"),
    @JsonSubTypes.Type(value = Assign.class, name = "Assign"),
    @JsonSubTypes.Type(value = Redirect.class, name = "Redirect"),
    @JsonSubTypes.Type(value = Word.class, name = "Word"),
    @JsonSubTypes.Type(value = Elif.class, name = "Elif"),
    @JsonSubTypes.Type(value = PatternList.class, name = "PatternList"),
    // Commands
    @JsonSubTypes.Type(value = CallExpr.class, name = "CallExpr"),
    @JsonSubTypes.Type(value = Subshell.class, name = "Subshell"),
    @JsonSubTypes.Type(value = Block.class, name = "Block"),
    @JsonSubTypes.Type(value = IfStmt.class, name = "IfStmt"),
    @JsonSubTypes.Type(value = WhileStmt.class, name = "WhileStmt"),
    @JsonSubTypes.Type(value = UntilStmt.class, name = "UntilStmt"),
    @JsonSubTypes.Type(value = ForStmt.class, name = "ForStmt"),
    @JsonSubTypes.Type(value = CaseStmt.class, name = "CaseStmt"),
    @JsonSubTypes.Type(value = FuncDecl.class, name = "FuncDecl"),
    @JsonSubTypes.Type(value = BinaryExpr.class, name = "BinaryExpr"),
    @JsonSubTypes.Type(value = NoCommand.class, name = "NoCommand"),
    // Word parts
    @JsonSubTypes.Type(value = Lit.class, name = "Lit"),
    @JsonSubTypes.Type(value = SglQuoted.class, name = "SglQuoted"),
    @JsonSubTypes.Type(value = DblQuoted.class, name = "DblQuoted"),
    @JsonSubTypes.Type(value = ParamExp.class, name = "ParamExp"),
    @JsonSubTypes.Type(value = ArithmExp.class, name = "ArithmExp"),
    @JsonSubTypes.Type(value = CmdSubst.class, name = "CmdSubst")
})
public abstract class NodeMixin {
}
