package com.esfront.ast;

import com.esfront.Span;

/**
 * Base interface for all AST nodes.
 */
public sealed interface Node permits
    Expr,
    Pat,
    Stmt,
    PropName,
    Prop,
    ObjectPatProp,
    TplElement,
    Function,
    VarDeclarator,
    Program {
    String type();

    Span span();
}
