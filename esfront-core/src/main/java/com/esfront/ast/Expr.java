package com.esfront.ast;

/** Expression node. */
public sealed interface Expr extends Node permits
    Ident,
    Str,
    Num,
    Bool,
    Null,
    Regex,
    Tpl,
    ArrayLit,
    ObjectLit,
    FnExpr,
    ThisExpr,
    ParenExpr,
    UnaryExpr,
    UpdateExpr,
    BinExpr,
    AssignExpr,
    CondExpr,
    CallExpr,
    NewExpr,
    MemberExpr,
    SeqExpr,
    YieldExpr,
    AwaitExpr,
    SpreadElement {
}
