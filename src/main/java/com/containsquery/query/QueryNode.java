package com.containsquery.query;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = QueryNode.EmptyQuery.class, name = "empty"),
        @JsonSubTypes.Type(value = QueryNode.BooleanQuery.class, name = "boolean"),
        @JsonSubTypes.Type(value = QueryNode.ExcludeQuery.class, name = "exclude"),
        @JsonSubTypes.Type(value = QueryNode.ThesaurusQuery.class, name = "thesaurus"),
        @JsonSubTypes.Type(value = QueryNode.ExactQuery.class, name = "exact"),
        @JsonSubTypes.Type(value = QueryNode.GroupQuery.class, name = "group"),
        @JsonSubTypes.Type(value = QueryNode.ProximityQuery.class, name = "proximity"),
        @JsonSubTypes.Type(value = QueryNode.PhraseQuery.class, name = "phrase"),
        @JsonSubTypes.Type(value = QueryNode.TermQuery.class, name = "term")
})
public sealed interface QueryNode permits QueryNode.EmptyQuery, QueryNode.BooleanQuery,
        QueryNode.ExcludeQuery, QueryNode.ThesaurusQuery, QueryNode.ExactQuery,
        QueryNode.GroupQuery, QueryNode.ProximityQuery, QueryNode.PhraseQuery,
        QueryNode.TermQuery {

    /** 布尔操作类型 */
    enum BoolOp {
        AND,
        OR
    }

    /** 空输入解析出的零操作数根节点 */
    record EmptyQuery() implements QueryNode {
    }

    record BooleanQuery(BoolOp op, QueryNode left, QueryNode right) implements QueryNode {
    }

    record ExcludeQuery(QueryNode child) implements QueryNode {
    }

    record ThesaurusQuery(String term) implements QueryNode {
    }

    /** '+' 修饰的词项或短语，text 不含引号 */
    record ExactQuery(String text) implements QueryNode {
    }

    record GroupQuery(QueryNode child) implements QueryNode {
    }

    record ProximityQuery(List<String> terms) implements QueryNode {
        public ProximityQuery {
            terms = List.copyOf(terms);
            if (terms.isEmpty()) {
                throw new IllegalArgumentException("邻近组至少需要一个词项");
            }
        }
    }

    /** 引号短语，text 已去掉两端引号 */
    record PhraseQuery(String text) implements QueryNode {
    }

    record TermQuery(String term) implements QueryNode {
    }
}
