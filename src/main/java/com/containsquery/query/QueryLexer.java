package com.containsquery.query;

import com.containsquery.config.Constants;

import java.util.ArrayList;
import java.util.List;

public class QueryLexer {
    /**
     * 将原始查询字符串切分为词法 token 序列，末尾追加 EOF。
     */
    public List<LexToken> tokenize(String query) {
        if (query == null) {
            throw new IllegalArgumentException("查询字符串不能为 null");
        }

        List<LexToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < query.length()) {
            char currentChar = query.charAt(index);
            if (Character.isWhitespace(currentChar)) {
                index++;
                continue;
            }

            if (currentChar == '"') {
                index = readPhraseToken(query, index, TokenType.DOUBLE_QUOTED_PHRASE, tokens);
                continue;
            }
            if (currentChar == '\'') {
                index = readPhraseToken(query, index, TokenType.SINGLE_QUOTED_PHRASE, tokens);
                continue;
            }

            TokenType symbolType = symbolType(currentChar);
            if (symbolType != null) {
                tokens.add(new LexToken(symbolType, String.valueOf(currentChar), index));
                index++;
                continue;
            }

            int tokenStart = index;
            while (index < query.length() && isTermChar(query.charAt(index))) {
                index++;
            }

            if (tokenStart == index) {
                throw new QueryParseException(QueryParseException.Kind.LEXICAL,
                        "无法识别字符: " + currentChar, index, query);
            }

            String value = query.substring(tokenStart, index);
            if (Constants.OR_KEYWORD.equalsIgnoreCase(value)) {
                tokens.add(new LexToken(TokenType.OR, value, tokenStart));
                continue;
            }
            if (Constants.AND_KEYWORD.equalsIgnoreCase(value)) {
                tokens.add(new LexToken(TokenType.AND, value, tokenStart));
                continue;
            }

            tokens.add(new LexToken(TokenType.TERM, value, tokenStart));
        }

        tokens.add(new LexToken(TokenType.EOF, "", query.length()));
        return tokens;
    }

    /**
     * 读取引号短语，直到下一个同类引号为止；短语内容原样保留，不支持转义。
     */
    private int readPhraseToken(String query, int quoteIndex, TokenType type, List<LexToken> tokens) {
        char quote = query.charAt(quoteIndex);
        int closingIndex = query.indexOf(quote, quoteIndex + 1);
        if (closingIndex < 0) {
            throw new QueryParseException(QueryParseException.Kind.LEXICAL, "未闭合引号", quoteIndex, query);
        }
        tokens.add(new LexToken(type, query.substring(quoteIndex + 1, closingIndex), quoteIndex));
        return closingIndex + 1;
    }

    /**
     * 单字符符号对应的 token 类型，非符号返回 null。
     */
    private TokenType symbolType(char currentChar) {
        switch (currentChar) {
            case '|':
                return TokenType.OR;
            case '&':
                return TokenType.AND;
            case '-':
                return TokenType.MINUS;
            case '~':
                return TokenType.TILDE;
            case '+':
                return TokenType.PLUS;
            case '(':
                return TokenType.LPAREN;
            case ')':
                return TokenType.RPAREN;
            case '<':
                return TokenType.LANGLE;
            case '>':
                return TokenType.RANGLE;
            default:
                return null;
        }
    }

    /**
     * 判断字符能否出现在裸词项中：字母、数字以及允许的标点。
     */
    static boolean isTermChar(char value) {
        return Character.isLetterOrDigit(value) || Constants.TERM_PUNCTUATION.indexOf(value) >= 0;
    }
}
