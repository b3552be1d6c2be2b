package com.posindex.query;

import java.util.ArrayList;
import java.util.List;

/**
 * 布尔查询解析器。
 *
 * 优先级从低到高：OR、AND（含相邻子句的隐式 AND）、NOT / 前缀减号、括号分组。
 */
public class QueryParser {
    private List<LexToken> tokens;
    private int pos;
    private String queryString;

    /**
     * 将查询字符串解析为语法树。
     *
     * @param query 查询字符串
     * @return 语法树根节点
     * @throws QueryParseException 语法错误时抛出
     */
    public QueryNode parse(String query) {
        this.tokens = new QueryLexer().tokenize(query);
        this.pos = 0;
        this.queryString = query;

        if (current().type() == TokenType.EOF) {
            throw new QueryParseException("查询不能为空", 0, queryString);
        }
        QueryNode ast = parseOrExpression();
        if (current().type() != TokenType.EOF) {
            throw new QueryParseException("意外token: " + current().value(), current().position(), queryString);
        }
        return ast;
    }

    /**
     * 解析 OR 层级，优先级低于 AND。
     */
    private QueryNode parseOrExpression() {
        QueryNode left = parseAndExpression();
        while (match(TokenType.OR)) {
            QueryNode right = parseAndExpression();
            left = new QueryNode.BooleanQuery(QueryNode.BoolOp.OR, left, right);
        }
        return left;
    }

    /**
     * 解析 AND 层级，并支持相邻子句的隐式 AND。
     */
    private QueryNode parseAndExpression() {
        QueryNode left = parseClause();
        while (match(TokenType.AND) || isImplicitAndStart(current().type())) {
            QueryNode right = parseClause();
            left = new QueryNode.BooleanQuery(QueryNode.BoolOp.AND, left, right);
        }
        return left;
    }

    /**
     * 解析可选前缀取反后的子句。
     */
    private QueryNode parseClause() {
        if (match(TokenType.NOT) || match(TokenType.MINUS)) {
            return new QueryNode.NotQuery(parseClause());
        }
        return parseExpression();
    }

    /**
     * 解析基础表达式：分组、短语、词项。
     */
    private QueryNode parseExpression() {
        LexToken token = current();
        switch (token.type()) {
            case LPAREN -> {
                advance();
                QueryNode grouped = parseOrExpression();
                expect(TokenType.RPAREN, "缺少右括号");
                return grouped;
            }
            case PHRASE -> {
                return parsePhrase();
            }
            case TERM -> {
                return new QueryNode.TermQuery(advance().value());
            }
            case EOF -> throw new QueryParseException("缺少操作数", token.position(), queryString);
            default -> throw new QueryParseException("无法解析表达式: " + token.value(), token.position(), queryString);
        }
    }

    /**
     * 解析短语表达式并按空白拆分为词项序列。
     */
    private QueryNode parsePhrase() {
        LexToken phraseToken = advance();
        List<String> terms = new ArrayList<>();
        for (String token : phraseToken.value().split("\\s+")) {
            if (!token.isBlank()) {
                terms.add(token);
            }
        }
        if (terms.isEmpty()) {
            throw new QueryParseException("短语不能为空", phraseToken.position(), queryString);
        }
        return new QueryNode.PhraseQuery(terms);
    }

    /**
     * 断言当前 token 类型符合预期，否则抛出带位置的语法错误。
     */
    private void expect(TokenType type, String message) {
        if (!match(type)) {
            throw new QueryParseException(message, current().position(), queryString);
        }
    }

    /**
     * 判断当前 token 是否可触发隐式 AND。
     */
    private boolean isImplicitAndStart(TokenType type) {
        return type == TokenType.TERM
                || type == TokenType.PHRASE
                || type == TokenType.LPAREN
                || type == TokenType.NOT
                || type == TokenType.MINUS;
    }

    private LexToken current() {
        return tokens.get(pos);
    }

    private LexToken advance() {
        return tokens.get(pos++);
    }

    /**
     * 若当前位置匹配指定类型则消费并返回 true。
     */
    private boolean match(TokenType type) {
        if (current().type() == type) {
            pos++;
            return true;
        }
        return false;
    }
}
