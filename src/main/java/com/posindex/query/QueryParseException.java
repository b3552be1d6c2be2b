package com.posindex.query;

/**
 * 查询语法错误，消息中附带原查询与指向出错位置的脱字符。
 */
public class QueryParseException extends RuntimeException {
    private final int position;
    private final String queryString;
    private final String suggestion;

    public QueryParseException(String message, int position, String queryString) {
        super(buildMessage(message, position, queryString == null ? "" : queryString));
        this.position = position;
        this.queryString = queryString == null ? "" : queryString;
        this.suggestion = suggestFix(position, this.queryString);
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
        return "查询语法错误，位置 " + pos + ": " + message + System.lineSeparator()
                + query + System.lineSeparator() + pointer;
    }

    private static String suggestFix(int pos, String query) {
        if (query.isBlank()) {
            return "请输入非空查询";
        }
        if (query.chars().filter(ch -> ch == '"').count() % 2 != 0) {
            return "检测到未闭合引号，请补全右引号";
        }
        long open = query.chars().filter(ch -> ch == '(').count();
        long close = query.chars().filter(ch -> ch == ')').count();
        if (open != close) {
            return "左右括号数量不一致";
        }
        if (pos >= query.length()) {
            return "查询在运算符后意外结束，请补全操作数";
        }
        return "请检查该位置附近的括号、引号或布尔运算符";
    }
}
