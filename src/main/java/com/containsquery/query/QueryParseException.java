package com.containsquery.query;

public class QueryParseException extends RuntimeException {

    /** 错误类别 */
    public enum Kind {
        LEXICAL,
        SYNTACTIC
    }

    private final Kind kind;
    private final int position;
    private final String queryString;
    private final String suggestion;

    public QueryParseException(Kind kind, String message, int position, String queryString) {
        super(buildMessage(message, position, queryString));
        this.kind = kind;
        this.position = position;
        this.queryString = queryString;
        this.suggestion = suggestFix(kind, position, queryString);
    }

    public Kind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    public String getQueryString() {
        return queryString;
    }

    public String getSuggestion() {
        return suggestion;
    }

    private static String buildMessage(String message, int pos, String query) {
        int caretPos = Math.max(0, Math.min(pos, query.length()));
        String pointer = " ".repeat(caretPos) + "^";
        return "Parse error at position " + pos + ": " + message + System.lineSeparator()
                + query + System.lineSeparator() + pointer;
    }

    private static String suggestFix(Kind kind, int pos, String query) {
        if (kind == Kind.LEXICAL && pos < query.length()) {
            char quote = query.charAt(pos);
            if (quote == '"' || quote == '\'') {
                return "检测到未闭合引号，请补全右引号 " + quote;
            }
            return "请删除无法识别的字符 '" + quote + "'";
        }
        if (pos >= query.length()) {
            return "查询在操作符后意外结束，请补全操作数或右括号";
        }
        return "请检查该位置附近的语法，例如括号、尖括号或布尔运算符";
    }
}
