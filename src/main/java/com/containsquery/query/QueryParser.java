package com.containsquery.query;

import com.containsquery.config.Constants;

import java.util.ArrayList;
import java.util.List;

/**
 * 搜索表达式的递归下降解析器。
 *
 * <pre>
 * Or        := And (("or" | "|") And)*
 * And       := Primary (("and" | "&amp;")? (Primary | Exclude))*
 * Exclude   := "-" Primary
 * Primary   := Term | Thesaurus | Exact | Group | Phrase | Proximity
 * Thesaurus := "~" Term
 * Exact     := "+" (Term | Phrase)
 * Group     := "(" Or ")"
 * Proximity := "&lt;" Term+ "&gt;"
 * </pre>
 *
 * 实例不保存单次解析的状态，可在多个线程间共享。
 */
public class QueryParser {
    private final QueryLexer lexer;
    private final int maxNestingDepth;

    public QueryParser() {
        this(Constants.MAX_NESTING_DEPTH);
    }

    public QueryParser(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth 必须为正数: " + maxNestingDepth);
        }
        this.lexer = new QueryLexer();
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * 将查询字符串解析为 AST；空白输入得到 {@link QueryNode.EmptyQuery}。
     */
    public QueryNode parse(String query) {
        if (query == null) {
            throw new IllegalArgumentException("查询字符串不能为 null");
        }
        Cursor cursor = new Cursor(lexer.tokenize(query), query);
        if (cursor.current().type() == TokenType.EOF) {
            return new QueryNode.EmptyQuery();
        }

        QueryNode ast = parseOrExpression(cursor, 0);

        if (cursor.current().type() != TokenType.EOF) {
            throw cursor.error("意外token: " + cursor.current().value());
        }
        return ast;
    }

    /**
     * 解析 OR 层级，优先级低于 AND，左结合。
     */
    private QueryNode parseOrExpression(Cursor cursor, int depth) {
        QueryNode left = parseAndExpression(cursor, depth);
        while (cursor.match(TokenType.OR)) {
            QueryNode right = parseAndExpression(cursor, depth);
            left = new QueryNode.BooleanQuery(QueryNode.BoolOp.OR, left, right);
        }
        return left;
    }

    /**
     * 解析 AND 层级，并支持相邻子句的隐式 AND；首个操作数不能是排除表达式。
     */
    private QueryNode parseAndExpression(Cursor cursor, int depth) {
        QueryNode left = parsePrimary(cursor, depth);
        while (true) {
            if (cursor.match(TokenType.AND)) {
                QueryNode right = parseOperand(cursor, depth);
                left = new QueryNode.BooleanQuery(QueryNode.BoolOp.AND, left, right);
                continue;
            }
            if (isOperandStart(cursor.current().type())) {
                QueryNode right = parseOperand(cursor, depth);
                left = new QueryNode.BooleanQuery(QueryNode.BoolOp.AND, left, right);
                continue;
            }
            break;
        }
        return left;
    }

    /**
     * 解析 AND 右侧操作数：基础表达式或 '-' 排除表达式。
     */
    private QueryNode parseOperand(Cursor cursor, int depth) {
        if (cursor.match(TokenType.MINUS)) {
            return new QueryNode.ExcludeQuery(parsePrimary(cursor, depth));
        }
        return parsePrimary(cursor, depth);
    }

    /**
     * 解析基础表达式：词项、短语、同义词、精确、分组、邻近。
     */
    private QueryNode parsePrimary(Cursor cursor, int depth) {
        LexToken token = cursor.current();
        switch (token.type()) {
            case TERM:
                cursor.advance();
                return new QueryNode.TermQuery(token.value());
            case SINGLE_QUOTED_PHRASE:
            case DOUBLE_QUOTED_PHRASE:
                cursor.advance();
                return new QueryNode.PhraseQuery(token.value());
            case TILDE:
                cursor.advance();
                return new QueryNode.ThesaurusQuery(cursor.expect(TokenType.TERM, "'~' 后缺少词项").value());
            case PLUS:
                cursor.advance();
                return parseExact(cursor);
            case LPAREN:
                return parseGroup(cursor, depth + 1);
            case LANGLE:
                return parseProximity(cursor);
            default:
                throw cursor.error(token.type() == TokenType.EOF
                        ? "缺少操作数"
                        : "此处需要操作数，实际为: " + token.value());
        }
    }

    /**
     * 解析 '+' 之后的词项或短语。
     */
    private QueryNode parseExact(Cursor cursor) {
        LexToken token = cursor.current();
        if (token.type() == TokenType.TERM || isPhrase(token.type())) {
            cursor.advance();
            return new QueryNode.ExactQuery(token.value());
        }
        throw cursor.error("'+' 后缺少词项或短语");
    }

    /**
     * 解析分组表达式，括号内重新从 OR 层级开始。
     */
    private QueryNode parseGroup(Cursor cursor, int depth) {
        if (depth > maxNestingDepth) {
            throw cursor.error("括号嵌套超过上限 " + maxNestingDepth);
        }
        cursor.expect(TokenType.LPAREN, "缺少左括号");
        QueryNode grouped = parseOrExpression(cursor, depth);
        cursor.expect(TokenType.RPAREN, "缺少右括号");
        return new QueryNode.GroupQuery(grouped);
    }

    /**
     * 解析邻近组，尖括号内只能是一个或多个裸词项。
     */
    private QueryNode parseProximity(Cursor cursor) {
        cursor.expect(TokenType.LANGLE, "缺少 '<'");
        List<String> terms = new ArrayList<>();
        while (cursor.current().type() == TokenType.TERM) {
            terms.add(cursor.advance().value());
        }
        if (terms.isEmpty()) {
            throw cursor.error("邻近组不能为空");
        }
        cursor.expect(TokenType.RANGLE, "邻近组缺少 '>'");
        return new QueryNode.ProximityQuery(terms);
    }

    /**
     * 判断当前 token 是否可触发隐式 AND。
     */
    private boolean isOperandStart(TokenType type) {
        return type == TokenType.TERM
                || isPhrase(type)
                || type == TokenType.TILDE
                || type == TokenType.PLUS
                || type == TokenType.LPAREN
                || type == TokenType.LANGLE
                || type == TokenType.MINUS;
    }

    private boolean isPhrase(TokenType type) {
        return type == TokenType.SINGLE_QUOTED_PHRASE || type == TokenType.DOUBLE_QUOTED_PHRASE;
    }

    /**
     * 单次解析的 token 游标。
     */
    private static final class Cursor {
        private final List<LexToken> tokens;
        private final String queryString;
        private int pos;

        Cursor(List<LexToken> tokens, String queryString) {
            this.tokens = tokens;
            this.queryString = queryString;
        }

        /**
         * 返回当前位置 token。
         */
        LexToken current() {
            return tokens.get(pos);
        }

        /**
         * 消费并返回当前位置 token。
         */
        LexToken advance() {
            return tokens.get(pos++);
        }

        /**
         * 若当前位置匹配指定类型则消费并返回 true。
         */
        boolean match(TokenType type) {
            if (current().type() == type) {
                pos++;
                return true;
            }
            return false;
        }

        /**
         * 断言当前 token 类型符合预期并消费，否则抛出带位置的语法错误。
         */
        LexToken expect(TokenType type, String message) {
            if (current().type() != type) {
                throw error(message);
            }
            return advance();
        }

        QueryParseException error(String message) {
            return new QueryParseException(QueryParseException.Kind.SYNTACTIC,
                    message, current().position(), queryString);
        }
    }
}
