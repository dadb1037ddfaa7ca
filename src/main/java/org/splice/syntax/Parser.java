package org.splice.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Recursive-descent parser. Parentheses around an expression, pattern or type produce no node of
 * their own; the printer puts them back where precedence requires.
 */
final class Parser {

    private final Session session;
    private final SourceFile file;
    private final List<Token> tokens;
    private int pos;
    private boolean noStructLiteral;

    Parser(Session session, SourceFile file) {
        this.session = session;
        this.file = file;
        this.tokens = Lexer.lex(file);
    }

    Node parseLone(NodeKind kind) {
        Node node;
        switch (kind) {
            case CRATE:
                return parseCrate();
            case ITEM:
                node = parseItem();
                break;
            case FOREIGN_ITEM:
                node = parseForeignItem();
                break;
            case ATTR:
                node = parseAttr();
                break;
            case STMT:
                node = parseStmt();
                break;
            case EXPR:
                node = parseExpr();
                break;
            case PAT:
                node = parsePat();
                break;
            case TY:
                node = parseTy();
                break;
            case BLOCK:
                node = parseBlock();
                break;
            default:
                throw new IllegalArgumentException("cannot parse a lone " + kind);
        }
        if (peek().kind != TokenKind.EOF) {
            throw error("expected exactly one " + kind.name().toLowerCase() + ", found trailing '"
                    + peek().text + "'");
        }
        return node;
    }

    // ===== Items =====

    private Node parseCrate() {
        List<Node> items = new ArrayList<>();
        while (peek().kind != TokenKind.EOF) {
            items.add(parseItem());
        }
        return new Node(Variant.CRATE, session.nextNodeId(), file.fullSpan(), items);
    }

    private Node parseItem() {
        int start = pos;
        List<Node> attrs = parseOuterAttrs();
        Visibility vis = parseVis();
        Node item;
        Token t = peek();
        if (t.isKeyword("const") && (peekAt(1).isKeyword("fn") || peekAt(1).isKeyword("unsafe")
                || peekAt(1).isKeyword("extern"))) {
            item = parseFn(start, attrs, vis);
        } else if (t.isKeyword("const")) {
            pos++;
            String name = expectIdent();
            expectPunct(":");
            Node ty = parseTy();
            expectPunct("=");
            Node value = parseExpr();
            expectPunct(";");
            item = node(Variant.ITEM_CONST, start, attrs, vis, name, ty, value);
        } else if (t.isKeyword("static")) {
            pos++;
            boolean mutable = eatKeyword("mut");
            String name = expectIdent();
            expectPunct(":");
            Node ty = parseTy();
            expectPunct("=");
            Node value = parseExpr();
            expectPunct(";");
            item = node(Variant.ITEM_STATIC, start, attrs, vis, mutable, name, ty, value);
        } else if (t.isKeyword("extern") && (peekAt(1).isPunct("{")
                || (peekAt(1).kind == TokenKind.STR && peekAt(2).isPunct("{")))) {
            if (vis != Visibility.INHERITED) {
                throw error("extern blocks cannot have a visibility");
            }
            item = parseForeignMod(start, attrs);
        } else if (t.isKeyword("unsafe") || t.isKeyword("extern") || t.isKeyword("fn")) {
            item = parseFn(start, attrs, vis);
        } else if (t.isKeyword("struct")) {
            pos++;
            String name = expectIdent();
            List<Node> fields = parseDelimited("{", "}", this::parseFieldDef);
            item = node(Variant.ITEM_STRUCT, start, attrs, vis, name, fields);
        } else if (t.isKeyword("mod")) {
            pos++;
            String name = expectIdent();
            expectPunct("{");
            List<Node> items = new ArrayList<>();
            while (!peek().isPunct("}")) {
                items.add(parseItem());
            }
            expectPunct("}");
            item = node(Variant.ITEM_MOD, start, attrs, vis, name, items);
        } else if (t.isKeyword("type")) {
            pos++;
            String name = expectIdent();
            expectPunct("=");
            Node ty = parseTy();
            expectPunct(";");
            item = node(Variant.ITEM_TYPE, start, attrs, vis, name, ty);
        } else {
            throw error("expected item, found '" + t.text + "'");
        }
        item.setTokens(tokens.subList(start, pos));
        return item;
    }

    private Node parseFn(int start, List<Node> attrs, Visibility vis) {
        boolean constness = eatKeyword("const");
        boolean unsafety = eatKeyword("unsafe");
        String abi = null;
        if (eatKeyword("extern")) {
            abi = peek().kind == TokenKind.STR ? next().text : "";
        }
        expectKeyword("fn");
        String name = expectIdent();
        List<Node> params = parseDelimited("(", ")", this::parseParam);
        Node ret = eatPunct("->") ? parseTy() : null;
        Node body = parseBlock();
        return node(Variant.ITEM_FN, start, attrs, vis, constness, unsafety, abi, name, params, ret, body);
    }

    private Node parseForeignMod(int start, List<Node> attrs) {
        expectKeyword("extern");
        String abi = peek().kind == TokenKind.STR ? next().text : "";
        expectPunct("{");
        List<Node> items = new ArrayList<>();
        while (!peek().isPunct("}")) {
            items.add(parseForeignItem());
        }
        expectPunct("}");
        return node(Variant.ITEM_FOREIGN_MOD, start, attrs, abi, items);
    }

    private Node parseForeignItem() {
        int start = pos;
        List<Node> attrs = parseOuterAttrs();
        Visibility vis = parseVis();
        Node item;
        if (eatKeyword("fn")) {
            String name = expectIdent();
            List<Node> params = parseDelimited("(", ")", this::parseParam);
            Node ret = eatPunct("->") ? parseTy() : null;
            expectPunct(";");
            item = node(Variant.FOREIGN_FN, start, attrs, vis, name, params, ret);
        } else if (eatKeyword("static")) {
            boolean mutable = eatKeyword("mut");
            String name = expectIdent();
            expectPunct(":");
            Node ty = parseTy();
            expectPunct(";");
            item = node(Variant.FOREIGN_STATIC, start, attrs, vis, mutable, name, ty);
        } else {
            throw error("expected foreign item, found '" + peek().text + "'");
        }
        item.setTokens(tokens.subList(start, pos));
        return item;
    }

    private List<Node> parseOuterAttrs() {
        List<Node> attrs = new ArrayList<>();
        while (peek().isPunct("#")) {
            attrs.add(parseAttr());
        }
        return attrs;
    }

    private Node parseAttr() {
        int start = pos;
        expectPunct("#");
        expectPunct("[");
        StringBuilder meta = new StringBuilder();
        Token prev = null;
        int depth = 0;
        while (depth > 0 || !peek().isPunct("]")) {
            Token t = next();
            if (t.kind == TokenKind.EOF) {
                throw error("unterminated attribute");
            }
            if (t.isPunct("[") || t.isPunct("(") || t.isPunct("{")) {
                depth++;
            } else if (t.isPunct("]") || t.isPunct(")") || t.isPunct("}")) {
                depth--;
            }
            if (prev != null && needsSpace(prev, t)) {
                meta.append(' ');
            }
            meta.append(t.text);
            prev = t;
        }
        expectPunct("]");
        if (meta.length() == 0) {
            throw error("empty attribute");
        }
        return node(Variant.ATTR, start, meta.toString());
    }

    private static boolean needsSpace(Token prev, Token t) {
        return (isWord(prev) && isWord(t)) || prev.isPunct(",") || prev.isPunct("=") || t.isPunct("=");
    }

    private static boolean isWord(Token t) {
        return t.kind != TokenKind.PUNCT && t.kind != TokenKind.EOF;
    }

    private Visibility parseVis() {
        if (!eatKeyword("pub")) {
            return Visibility.INHERITED;
        }
        if (peek().isPunct("(") && peekAt(1).isKeyword("crate") && peekAt(2).isPunct(")")) {
            pos += 3;
            return Visibility.CRATE;
        }
        return Visibility.PUBLIC;
    }

    private Node parseParam() {
        int start = pos;
        Node pat = parsePat();
        expectPunct(":");
        Node ty = parseTy();
        return node(Variant.PARAM, start, pat, ty);
    }

    private Node parseFieldDef() {
        int start = pos;
        Visibility vis = parseVis();
        String name = expectIdent();
        expectPunct(":");
        Node ty = parseTy();
        return node(Variant.FIELD_DEF, start, vis, name, ty);
    }

    // ===== Blocks and statements =====

    private Node parseBlock() {
        int start = pos;
        boolean saved = noStructLiteral;
        noStructLiteral = false;
        expectPunct("{");
        List<Node> stmts = new ArrayList<>();
        while (!peek().isPunct("}")) {
            if (peek().kind == TokenKind.EOF) {
                throw error("unclosed block");
            }
            stmts.add(parseStmt());
        }
        expectPunct("}");
        noStructLiteral = saved;
        return node(Variant.BLOCK, start, stmts);
    }

    private Node parseStmt() {
        int start = pos;
        if (eatKeyword("let")) {
            Node pat = parsePat();
            Node ty = eatPunct(":") ? parseTy() : null;
            Node init = eatPunct("=") ? parseExpr() : null;
            expectPunct(";");
            return node(Variant.STMT_LOCAL, start, pat, ty, init);
        }
        if (startsItem()) {
            Node item = parseItem();
            return node(Variant.STMT_ITEM, start, item);
        }
        Node expr = startsBlockLike() ? parseBlockLike() : parseExpr();
        if (eatPunct(";")) {
            return node(Variant.STMT_SEMI, start, expr);
        }
        if (ExprPrecedence.isBlockLike(expr) || peek().isPunct("}") || peek().kind == TokenKind.EOF) {
            return node(Variant.STMT_EXPR, start, expr);
        }
        throw error("expected ';', found '" + peek().text + "'");
    }

    private boolean startsItem() {
        Token t = peek();
        if (t.isPunct("#")) {
            return true;
        }
        if (t.kind != TokenKind.KEYWORD) {
            return false;
        }
        switch (t.text) {
            case "pub":
            case "fn":
            case "struct":
            case "static":
            case "const":
            case "mod":
            case "type":
            case "extern":
                return true;
            case "unsafe":
                return peekAt(1).isKeyword("fn") || peekAt(1).isKeyword("extern");
            default:
                return false;
        }
    }

    private boolean startsBlockLike() {
        Token t = peek();
        return t.isPunct("{") || t.isKeyword("if") || t.isKeyword("while")
                || (t.isKeyword("unsafe") && peekAt(1).isPunct("{"));
    }

    private Node parseBlockLike() {
        Token t = peek();
        if (t.isKeyword("if")) {
            return parseIf();
        }
        if (t.isKeyword("while")) {
            return parseWhile();
        }
        return parseBlockExpr();
    }

    // ===== Expressions =====

    private Node parseExpr() {
        return parseAssoc(ExprPrecedence.RESET);
    }

    private Node parseAssoc(int minPrec) {
        int start = pos;
        Node lhs = parsePrefix();
        while (true) {
            Token t = peek();
            if (t.isKeyword("as")) {
                if (ExprPrecedence.CAST < minPrec) {
                    break;
                }
                pos++;
                Node ty = parseTy();
                lhs = node(Variant.EXPR_CAST, start, lhs, ty);
                continue;
            }
            if (t.isPunct("=")) {
                if (ExprPrecedence.ASSIGN < minPrec) {
                    break;
                }
                pos++;
                Node rhs = parseAssoc(ExprPrecedence.assignRightPrec());
                lhs = node(Variant.EXPR_ASSIGN, start, lhs, rhs);
                continue;
            }
            BinOp op = t.kind == TokenKind.PUNCT ? BinOp.fromToken(t.text) : null;
            if (op == null || op.precedence < minPrec) {
                break;
            }
            pos++;
            Node rhs = parseAssoc(ExprPrecedence.rightPrec(op));
            lhs = node(Variant.EXPR_BINARY, start, op, lhs, rhs);
            if (op.fixity == Fixity.NONE) {
                BinOp following = peek().kind == TokenKind.PUNCT ? BinOp.fromToken(peek().text) : null;
                if (following != null && following.precedence == op.precedence) {
                    throw error("comparison operators cannot be chained");
                }
            }
        }
        return lhs;
    }

    private Node parsePrefix() {
        int start = pos;
        Token t = peek();
        if (t.kind == TokenKind.PUNCT) {
            UnOp op = UnOp.fromToken(t.text);
            if (op != null) {
                pos++;
                Node operand = parsePrefix();
                return node(Variant.EXPR_UNARY, start, op, operand);
            }
            if (t.isPunct("&")) {
                pos++;
                boolean mutable = eatKeyword("mut");
                Node operand = parsePrefix();
                return node(Variant.EXPR_ADDR_OF, start, mutable, operand);
            }
            if (t.isPunct("&&")) {
                // `&&x` is two borrows.
                pos++;
                boolean mutable = eatKeyword("mut");
                Node operand = parsePrefix();
                Node inner = new Node(Variant.EXPR_ADDR_OF, session.nextNodeId(),
                        file.span(t.span.lo() + 1, prevHi()), mutable, operand);
                return node(Variant.EXPR_ADDR_OF, start, false, inner);
            }
        }
        if (t.isKeyword("return")) {
            pos++;
            Node value = canStartExpr(peek()) ? parseExpr() : null;
            return node(Variant.EXPR_RETURN, start, value);
        }
        return parsePostfix(start, parsePrimary());
    }

    private boolean canStartExpr(Token t) {
        if (t.kind == TokenKind.EOF) {
            return false;
        }
        if (t.kind == TokenKind.PUNCT) {
            switch (t.text) {
                case ";":
                case "}":
                case ")":
                case "]":
                case ",":
                    return false;
                case "{":
                    return !noStructLiteral;
                default:
                    return true;
            }
        }
        return !t.isKeyword("else") && !t.isKeyword("as");
    }

    private Node parsePostfix(int start, Node base) {
        Node e = base;
        while (true) {
            if (peek().isPunct("(")) {
                List<Node> args = withStructLiterals(() -> parseDelimited("(", ")", this::parseExpr));
                e = node(Variant.EXPR_CALL, start, e, args);
            } else if (peek().isPunct("[")) {
                pos++;
                Node index = withStructLiterals(this::parseExpr);
                expectPunct("]");
                e = node(Variant.EXPR_INDEX, start, e, index);
            } else if (eatPunct(".")) {
                Token name = next();
                if (name.kind == TokenKind.IDENT && peek().isPunct("(")) {
                    List<Node> args = withStructLiterals(() -> parseDelimited("(", ")", this::parseExpr));
                    e = node(Variant.EXPR_METHOD_CALL, start, e, name.text, args);
                } else if (name.kind == TokenKind.IDENT || name.kind == TokenKind.INT) {
                    e = node(Variant.EXPR_FIELD, start, e, name.text);
                } else {
                    throw error("expected field or method name, found '" + name.text + "'");
                }
            } else {
                return e;
            }
        }
    }

    private Node parsePrimary() {
        int start = pos;
        Token t = peek();
        switch (t.kind) {
            case INT:
            case FLOAT:
            case STR:
                pos++;
                return node(Variant.EXPR_LIT, start, t.text);
            case IDENT:
                String path = parsePath();
                if (peek().isPunct("{") && !noStructLiteral) {
                    List<Node> fields = withStructLiterals(() -> parseDelimited("{", "}", this::parseFieldInit));
                    return node(Variant.EXPR_STRUCT, start, path, fields);
                }
                return node(Variant.EXPR_PATH, start, path);
            case KEYWORD:
                if (t.isKeyword("true") || t.isKeyword("false")) {
                    pos++;
                    return node(Variant.EXPR_LIT, start, t.text);
                }
                if (t.isKeyword("if")) {
                    return parseIf();
                }
                if (t.isKeyword("while")) {
                    return parseWhile();
                }
                if (t.isKeyword("unsafe") && peekAt(1).isPunct("{")) {
                    return parseBlockExpr();
                }
                break;
            case PUNCT:
                if (t.isPunct("{")) {
                    return parseBlockExpr();
                }
                if (t.isPunct("(")) {
                    return withStructLiterals(() -> parseParenOrTuple(start));
                }
                break;
            default:
                break;
        }
        throw error("expected expression, found '" + t.text + "'");
    }

    private Node parseParenOrTuple(int start) {
        expectPunct("(");
        if (eatPunct(")")) {
            return node(Variant.EXPR_TUPLE, start, List.of());
        }
        Node first = parseExpr();
        if (eatPunct(")")) {
            return first;
        }
        List<Node> elems = new ArrayList<>();
        elems.add(first);
        while (eatPunct(",")) {
            if (peek().isPunct(")")) {
                break;
            }
            elems.add(parseExpr());
        }
        expectPunct(")");
        return node(Variant.EXPR_TUPLE, start, elems);
    }

    private Node parseFieldInit() {
        int start = pos;
        String name = expectIdent();
        expectPunct(":");
        Node expr = parseExpr();
        return node(Variant.FIELD_INIT, start, name, expr);
    }

    private Node parseBlockExpr() {
        int start = pos;
        boolean unsafety = eatKeyword("unsafe");
        Node block = parseBlock();
        return node(Variant.EXPR_BLOCK, start, unsafety, block);
    }

    private Node parseIf() {
        int start = pos;
        expectKeyword("if");
        Node cond = parseCond();
        Node then = parseBlock();
        Node otherwise = null;
        if (eatKeyword("else")) {
            otherwise = peek().isKeyword("if") ? parseIf() : parseBlockExpr();
        }
        return node(Variant.EXPR_IF, start, cond, then, otherwise);
    }

    private Node parseWhile() {
        int start = pos;
        expectKeyword("while");
        Node cond = parseCond();
        Node body = parseBlock();
        return node(Variant.EXPR_WHILE, start, cond, body);
    }

    private Node parseCond() {
        boolean saved = noStructLiteral;
        noStructLiteral = true;
        try {
            return parseExpr();
        } finally {
            noStructLiteral = saved;
        }
    }

    private <T> T withStructLiterals(Supplier<T> parse) {
        boolean saved = noStructLiteral;
        noStructLiteral = false;
        try {
            return parse.get();
        } finally {
            noStructLiteral = saved;
        }
    }

    private String parsePath() {
        StringBuilder path = new StringBuilder(expectIdent());
        while (peek().isPunct("::")) {
            pos++;
            path.append("::").append(expectIdent());
        }
        return path.toString();
    }

    // ===== Patterns and types =====

    private Node parsePat() {
        int start = pos;
        if (eatPunct("_")) {
            return node(Variant.PAT_WILD, start);
        }
        if (eatKeyword("mut")) {
            return node(Variant.PAT_IDENT, start, true, expectIdent());
        }
        if (peek().kind == TokenKind.IDENT) {
            return node(Variant.PAT_IDENT, start, false, expectIdent());
        }
        if (peek().isPunct("(")) {
            List<Node> elems = new ArrayList<>();
            boolean trailingComma = parseTupleElems(elems, this::parsePat);
            if (elems.size() == 1 && !trailingComma) {
                return elems.get(0);
            }
            return node(Variant.PAT_TUPLE, start, elems);
        }
        throw error("expected pattern, found '" + peek().text + "'");
    }

    private Node parseTy() {
        int start = pos;
        Token t = peek();
        if (t.isPunct("&")) {
            pos++;
            boolean mutable = eatKeyword("mut");
            return node(Variant.TY_REF, start, mutable, parseTy());
        }
        if (t.isPunct("&&")) {
            pos++;
            boolean mutable = eatKeyword("mut");
            Node innerTy = parseTy();
            Node inner = new Node(Variant.TY_REF, session.nextNodeId(),
                    file.span(t.span.lo() + 1, prevHi()), mutable, innerTy);
            return node(Variant.TY_REF, start, false, inner);
        }
        if (t.isPunct("*")) {
            pos++;
            boolean mutable;
            if (eatKeyword("mut")) {
                mutable = true;
            } else {
                expectKeyword("const");
                mutable = false;
            }
            return node(Variant.TY_PTR, start, mutable, parseTy());
        }
        if (t.isPunct("(")) {
            List<Node> elems = new ArrayList<>();
            boolean trailingComma = parseTupleElems(elems, this::parseTy);
            if (elems.size() == 1 && !trailingComma) {
                return elems.get(0);
            }
            return node(Variant.TY_TUPLE, start, elems);
        }
        if (t.kind == TokenKind.IDENT) {
            return node(Variant.TY_PATH, start, parsePath());
        }
        throw error("expected type, found '" + t.text + "'");
    }

    /** Parses {@code ( a, b, ... )} and reports whether the last element had a trailing comma. */
    private boolean parseTupleElems(List<Node> elems, Supplier<Node> element) {
        expectPunct("(");
        boolean trailingComma = false;
        while (!peek().isPunct(")")) {
            elems.add(element.get());
            trailingComma = eatPunct(",");
            if (!trailingComma) {
                break;
            }
        }
        expectPunct(")");
        return trailingComma;
    }

    private List<Node> parseDelimited(String open, String close, Supplier<Node> element) {
        expectPunct(open);
        List<Node> result = new ArrayList<>();
        while (!peek().isPunct(close)) {
            result.add(element.get());
            if (!eatPunct(",")) {
                break;
            }
        }
        expectPunct(close);
        return result;
    }

    // ===== Token plumbing =====

    private Node node(Variant variant, int startToken, Object... values) {
        Span span = file.span(tokens.get(startToken).span.lo(), prevHi());
        return new Node(variant, session.nextNodeId(), span, values);
    }

    private int prevHi() {
        return pos == 0 ? 0 : tokens.get(pos - 1).span.hi();
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.kind != TokenKind.EOF) {
            pos++;
        }
        return t;
    }

    private boolean eatPunct(String punct) {
        if (peek().isPunct(punct)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean eatKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expectPunct(String punct) {
        if (!eatPunct(punct)) {
            throw error("expected '" + punct + "', found '" + peek().text + "'");
        }
    }

    private void expectKeyword(String keyword) {
        if (!eatKeyword(keyword)) {
            throw error("expected '" + keyword + "', found '" + peek().text + "'");
        }
    }

    private String expectIdent() {
        Token t = peek();
        if (t.kind != TokenKind.IDENT) {
            throw error("expected identifier, found '" + t.text + "'");
        }
        pos++;
        return t.text;
    }

    private ParseException error(String message) {
        return new ParseException(peek().span, message);
    }
}
