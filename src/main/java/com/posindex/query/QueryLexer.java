package com.posindex.query;

import java.util.ArrayList;
import java.util.List;

public class QueryLexer {
    /**
     * 将原始查询字符串切分为词法 token 序列，末尾追加 EOF。
     */
    public List<LexToken> tokenize(String query) {
        if (query == null) {
            throw new QueryParseException("查询字符串不能为空", 0, "");
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
                index = readPhraseToken(query, index, tokens);
                continue;
            }
            if (currentChar == '(') {
                tokens.add(new LexToken(TokenType.LPAREN, "(", index++));
                continue;
            }
            if (currentChar == ')') {
                tokens.add(new LexToken(TokenType.RPAREN, ")", index++));
                continue;
            }
            if (currentChar == '-') {
                tokens.add(new LexToken(TokenType.MINUS, "-", index++));
                continue;
            }

            int tokenStart = index;
            while (index < query.length() && !isDelimiter(query.charAt(index))) {
                index++;
            }
            String value = query.substring(tokenStart, index);
            tokens.add(new LexToken(keywordOrTerm(value), value, tokenStart));
        }

        tokens.add(new LexToken(TokenType.EOF, "", query.length()));
        return tokens;
    }

    private boolean isDelimiter(char ch) {
        return Character.isWhitespace(ch) || ch == '(' || ch == ')' || ch == '"';
    }

    /**
     * 只有大写的 AND / OR / NOT 是运算符，小写形式是普通词项。
     */
    private TokenType keywordOrTerm(String value) {
        return switch (value) {
            case "AND" -> TokenType.AND;
            case "OR" -> TokenType.OR;
            case "NOT" -> TokenType.NOT;
            default -> TokenType.TERM;
        };
    }

    /**
     * 读取带转义的双引号短语并追加 PHRASE token。
     */
    private int readPhraseToken(String query, int quoteIndex, List<LexToken> tokens) {
        int index = quoteIndex + 1;
        StringBuilder phraseBuilder = new StringBuilder();
        boolean closed = false;
        while (index < query.length()) {
            char currentChar = query.charAt(index);
            if (currentChar == '\\' && index + 1 < query.length()) {
                char escaped = query.charAt(index + 1);
                if (escaped == '"' || escaped == '\\') {
                    phraseBuilder.append(escaped);
                    index += 2;
                    continue;
                }
            }
            if (currentChar == '"') {
                closed = true;
                index++;
                break;
            }
            phraseBuilder.append(currentChar);
            index++;
        }
        if (!closed) {
            throw new QueryParseException("未闭合引号", quoteIndex, query);
        }
        tokens.add(new LexToken(TokenType.PHRASE, phraseBuilder.toString(), quoteIndex));
        return index;
    }
}
