package com.containsquery.query;

/**
 * 裸词项的默认检索方式。
 */
public enum SearchPhraseMode {
    /**
     * 默认按完整单词检索，并借助词干提取匹配全部屈折形式；需要前缀检索时在词尾加 '*'。
     */
    INFLECTIONAL,

    /**
     * 默认按前缀检索。
     */
    PREFIX
}
