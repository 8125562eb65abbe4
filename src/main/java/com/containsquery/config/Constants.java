package com.containsquery.config;

/**
 * 全局常量定义
 * 
 * 包含搜索语法关键字、词项字符集、回退分词参数和安全上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 语法关键字 ====================
    /** OR 关键字，大小写不敏感 */
    public static final String OR_KEYWORD = "or";
    /** AND 关键字，大小写不敏感 */
    public static final String AND_KEYWORD = "and";
    /** 裸词项中允许出现的标点 */
    public static final String TERM_PUNCTUATION = "!@#$%^*_'.?";
    /** 前缀通配符 */
    public static final char WILDCARD = '*';

    // ==================== 回退分词参数 ====================
    /** 回退分词时删除的标点 */
    public static final String FALLBACK_STRIPPED_PUNCTUATION = "!@#$%^*_'.?\"();+-&|";

    // ==================== 安全上限 ====================
    /** 括号嵌套深度上限 */
    public static final int MAX_NESTING_DEPTH = 64;
    /** CLI 接受的查询长度上限 */
    public static final int MAX_QUERY_LENGTH = 4096;
}
