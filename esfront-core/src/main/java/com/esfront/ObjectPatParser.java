package com.esfront;

import com.esfront.ast.AssignPatProp;
import com.esfront.ast.Expr;
import com.esfront.ast.Ident;
import com.esfront.ast.KeyValuePatProp;
import com.esfront.ast.ObjectPat;
import com.esfront.ast.ObjectPatProp;
import com.esfront.ast.Pat;
import com.esfront.ast.PropName;
import com.esfront.ast.RestPat;

import java.util.List;

/**
 * Object pattern properties: {@code key: target}, {@code name}, {@code name = default}
 * and a trailing {@code ...rest}.
 */
final class ObjectPatParser implements ParseObject<ObjectPat, ObjectPatProp> {

    @Override
    public ObjectPatProp parseObjectProp(Parser parser) {
        TokenBuffer tokens = parser.tokens();
        int start = tokens.curPos();

        if (tokens.eat(TokenType.DOT_DOT_DOT)) {
            Ident arg = parser.parseBindingIdentifier();
            RestPat rest = new RestPat(tokens.span(start), arg);
            if (!tokens.is(TokenType.RBRACE)) {
                throw tokens.error(SyntaxError.REST_NOT_LAST, rest.span(), null);
            }
            return rest;
        }

        PropName key = parser.parsePropName();

        if (tokens.eat(TokenType.COLON)) {
            Pat value = parser.parseBindingElement();
            return new KeyValuePatProp(tokens.span(start), key, value);
        }

        if (!(key instanceof Ident ident)) {
            throw tokens.unexpected();
        }
        if (tokens.eat(TokenType.ASSIGN)) {
            Expr value = parser.parseAssignExprAllowIn();
            return new AssignPatProp(tokens.span(start), ident, value);
        }
        if (parser.isReservedWord(ident.sym())) {
            throw tokens.error(SyntaxError.RESERVED_WORD_IN_OBJ_SHORTHAND_OR_PAT, ident.span(),
                    "'" + ident.sym() + "' cannot be used as a binding name");
        }
        return new AssignPatProp(ident.span(), ident, null);
    }

    @Override
    public ObjectPat makeObject(Span span, List<ObjectPatProp> props) {
        return new ObjectPat(span, props);
    }
}
