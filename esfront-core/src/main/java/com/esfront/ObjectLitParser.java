package com.esfront;

import com.esfront.ast.AssignProp;
import com.esfront.ast.BlockStmt;
import com.esfront.ast.Expr;
import com.esfront.ast.Function;
import com.esfront.ast.GetterProp;
import com.esfront.ast.Ident;
import com.esfront.ast.KeyValueProp;
import com.esfront.ast.MethodProp;
import com.esfront.ast.ObjectLit;
import com.esfront.ast.Pat;
import com.esfront.ast.Prop;
import com.esfront.ast.PropName;
import com.esfront.ast.SetterProp;
import com.esfront.ast.ShorthandProp;
import com.esfront.ast.SpreadElement;

import java.util.List;

/**
 * Object literal properties: key/value, shorthand, methods, accessors,
 * {@code async} and generator methods, spread, and the {@code a = 1} cover form.
 */
final class ObjectLitParser implements ParseObject<ObjectLit, Prop> {

    @Override
    public Prop parseObjectProp(Parser parser) {
        TokenBuffer tokens = parser.tokens();
        int start = tokens.curPos();

        if (tokens.eat(TokenType.DOT_DOT_DOT)) {
            Expr arg = parser.parseAssignExprAllowIn();
            return new SpreadElement(tokens.span(start), arg);
        }

        if (tokens.eat(TokenType.STAR)) {
            PropName name = parser.parsePropName();
            Function func = parser.parseFunctionRest(start, true, false, true);
            return new MethodProp(tokens.span(start), name, func);
        }

        PropName key = parser.parsePropName();

        if (tokens.eat(TokenType.COLON)) {
            Expr value = parser.parseAssignExprAllowIn();
            return new KeyValueProp(tokens.span(start), key, value);
        }

        if (tokens.is(TokenType.LPAREN)) {
            Function func = parser.parseFunctionRest(start, false, false, true);
            return new MethodProp(tokens.span(start), key, func);
        }

        if (!(key instanceof Ident ident)) {
            throw tokens.unexpected();
        }

        if (tokens.isOneOf(TokenType.ASSIGN, TokenType.COMMA, TokenType.RBRACE)) {
            if (parser.isReservedWord(ident.sym())) {
                throw tokens.error(SyntaxError.RESERVED_WORD_IN_OBJ_SHORTHAND_OR_PAT, ident.span(),
                        "'" + ident.sym() + "' cannot be used as a shorthand property");
            }
            if (tokens.eat(TokenType.ASSIGN)) {
                Expr value = parser.parseAssignExprAllowIn();
                AssignProp prop = new AssignProp(tokens.span(start), ident, value);
                parser.registerCoverInit(prop);
                return prop;
            }
            return new ShorthandProp(ident.span(), ident);
        }

        // get/set/async must be written without escapes to act as modifiers
        if (ident.span().len() != ident.sym().length()) {
            throw tokens.unexpected();
        }

        switch (ident.sym()) {
            case "get": {
                PropName name = parser.parsePropName();
                BlockStmt body = parser.inFunctionContext(false, false, () -> {
                    tokens.expect(TokenType.LPAREN);
                    tokens.expect(TokenType.RPAREN);
                    return parser.parseFunctionBody();
                });
                return new GetterProp(tokens.span(start), name, body);
            }
            case "set": {
                PropName name = parser.parsePropName();
                return parser.inFunctionContext(false, false, () -> {
                    tokens.expect(TokenType.LPAREN);
                    Pat param = parser.parseBindingElement();
                    tokens.expect(TokenType.RPAREN);
                    BlockStmt body = parser.parseFunctionBody();
                    return new SetterProp(tokens.span(start), name, param, body);
                });
            }
            case "async": {
                if (tokens.hadLineBreakBeforeCur()) {
                    throw tokens.unexpected();
                }
                boolean isGenerator = tokens.eat(TokenType.STAR);
                PropName name = parser.parsePropName();
                Function func = parser.parseFunctionRest(start, isGenerator, true, true);
                return new MethodProp(tokens.span(start), name, func);
            }
            default:
                throw tokens.unexpected();
        }
    }

    @Override
    public ObjectLit makeObject(Span span, List<Prop> props) {
        return new ObjectLit(span, props);
    }
}
