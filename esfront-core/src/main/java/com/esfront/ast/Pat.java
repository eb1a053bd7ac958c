package com.esfront.ast;

/** Binding or assignment target. */
public sealed interface Pat extends Node permits
    Ident,
    MemberExpr,
    RestPat,
    ObjectPat,
    ArrayPat,
    AssignPat {
}
