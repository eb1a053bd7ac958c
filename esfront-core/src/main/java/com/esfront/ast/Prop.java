package com.esfront.ast;

/** Property of an object literal. */
public sealed interface Prop extends Node permits
    ShorthandProp,
    KeyValueProp,
    AssignProp,
    GetterProp,
    SetterProp,
    MethodProp,
    SpreadElement {
}
