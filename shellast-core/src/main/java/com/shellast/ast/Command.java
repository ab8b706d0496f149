package com.shellast.ast;

/**
 * The command wrapped by a {@link Stmt}. {@link NoCommand} is the explicit
 * case for statements made only of assignments or redirections.
 */
public sealed interface Command extends Node permits
    CallExpr,
    Subshell,
    Block,
    IfStmt,
    WhileStmt,
    UntilStmt,
    ForStmt,
    CaseStmt,
    FuncDecl,
    BinaryExpr,
    NoCommand {
}
