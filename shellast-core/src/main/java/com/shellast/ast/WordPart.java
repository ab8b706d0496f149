package com.shellast.ast;

/**
 * A fragment of a {@link Word}: literal text, quoting or an expansion.
 */
public sealed interface WordPart extends Node permits
    Lit,
    SglQuoted,
    DblQuoted,
    ParamExp,
    ArithmExp,
    CmdSubst {
}
