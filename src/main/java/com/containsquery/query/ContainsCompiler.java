package com.containsquery.query;

import com.containsquery.config.Constants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 将搜索 AST 编译为 CONTAINS / CONTAINSTABLE 谓词文本。
 */
public class ContainsCompiler {

    /** 遍历时携带的词项格式上下文 */
    enum TermMode {
        INFLECTIONAL,
        EXACT
    }

    /**
     * 按给定的短语模式编译整棵树；同一棵树可以用不同模式重复编译。
     */
    public String compile(QueryNode root, SearchPhraseMode phraseMode) {
        if (root == null) {
            throw new IllegalArgumentException("AST 不能为 null");
        }
        if (phraseMode == null) {
            throw new IllegalArgumentException("phraseMode 不能为 null");
        }
        return compileNode(root, TermMode.INFLECTIONAL, phraseMode);
    }

    /**
     * 按节点类型分派；QueryNode 为 sealed，permits 中的每个变体都在此处理，末尾的异常只在新增变体漏改时出现。
     */
    private String compileNode(QueryNode node, TermMode mode, SearchPhraseMode phraseMode) {
        if (node instanceof QueryNode.EmptyQuery) {
            return "";
        }
        if (node instanceof QueryNode.BooleanQuery booleanQuery) {
            return compileBoolean(booleanQuery, mode, phraseMode);
        }
        if (node instanceof QueryNode.ExcludeQuery excludeQuery) {
            return "NOT(" + compileNode(excludeQuery.child(), TermMode.INFLECTIONAL, phraseMode) + ")";
        }
        if (node instanceof QueryNode.ThesaurusQuery thesaurusQuery) {
            return "FORMSOF (THESAURUS, " + thesaurusQuery.term() + ")";
        }
        if (node instanceof QueryNode.ExactQuery exactQuery) {
            return quote(exactQuery.text());
        }
        if (node instanceof QueryNode.GroupQuery groupQuery) {
            return "(" + compileNode(groupQuery.child(), mode, phraseMode) + ")";
        }
        if (node instanceof QueryNode.PhraseQuery phraseQuery) {
            return quote(phraseQuery.text());
        }
        if (node instanceof QueryNode.ProximityQuery proximityQuery) {
            List<String> parts = new ArrayList<>(proximityQuery.terms().size());
            for (String term : proximityQuery.terms()) {
                parts.add(formatTerm(term, TermMode.EXACT, phraseMode));
            }
            return "(" + String.join(" NEAR ", parts) + ")";
        }
        if (node instanceof QueryNode.TermQuery termQuery) {
            return formatTerm(termQuery.term(), mode, phraseMode);
        }
        throw new IllegalStateException("编译器无法处理节点类型: " + node.getClass().getName());
    }

    /**
     * 同一操作符的左结合链沿左脊迭代展开，链长不受调用栈深度限制。
     */
    private String compileBoolean(QueryNode.BooleanQuery root, TermMode mode, SearchPhraseMode phraseMode) {
        QueryNode.BoolOp op = root.op();
        List<QueryNode> rightOperands = new ArrayList<>();
        QueryNode leftmost = root;
        while (leftmost instanceof QueryNode.BooleanQuery booleanQuery && booleanQuery.op() == op) {
            rightOperands.add(booleanQuery.right());
            leftmost = booleanQuery.left();
        }
        Collections.reverse(rightOperands);

        StringBuilder builder = new StringBuilder();
        if (op == QueryNode.BoolOp.OR) {
            // 每个 OR 都带外层括号，保证 OR 在目标语法中依旧比 AND 松
            builder.append("(".repeat(rightOperands.size()));
            builder.append(compileNode(leftmost, mode, phraseMode));
            for (QueryNode operand : rightOperands) {
                builder.append(" OR ").append(compileNode(operand, mode, phraseMode)).append(')');
            }
            return builder.toString();
        }

        builder.append(compileNode(leftmost, TermMode.INFLECTIONAL, phraseMode));
        for (QueryNode operand : rightOperands) {
            builder.append(" AND ").append(compileNode(operand, TermMode.INFLECTIONAL, phraseMode));
        }
        return builder.toString();
    }

    /**
     * 按上下文模式格式化裸词项；已带 '*' 的词项总是按字面前缀检索。
     */
    static String formatTerm(String term, TermMode mode, SearchPhraseMode phraseMode) {
        if (mode == TermMode.EXACT) {
            return term;
        }
        if (!term.isEmpty() && term.charAt(term.length() - 1) == Constants.WILDCARD) {
            return quote(term);
        }
        if (phraseMode == SearchPhraseMode.PREFIX) {
            return quote(term + Constants.WILDCARD);
        }
        return "FORMSOF (INFLECTIONAL, " + term + ")";
    }

    static String quote(String text) {
        return "\"" + text + "\"";
    }
}
