/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.dirserve.upnp.cd.criteria;

import com.dirserve.library.LibrarySearch;
import com.dirserve.library.SearchTable;
import com.dirserve.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decodes UPnP SearchCriteria into a parameterized SQL predicate.
 *
 * <pre>
 * searchCrit := '*' | orExp
 * orExp      := andExp ( 'or' andExp )*
 * andExp     := primary ( 'and' primary )*
 * primary    := '(' orExp ')' | property op value
 * op         := contains | doesNotContain | startsWith | derivedfrom | exists
 *             | '=' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;='
 * </pre>
 *
 * <p>{@code upnp:class} constraints pick the searched table (videos for
 * {@code object.item.videoItem}, images for {@code object.item.imageItem},
 * tracks otherwise) and otherwise match everything. Text is compared against the
 * upper-cased {@code *search} columns, so text values are upper-cased too.
 * Values are always bound as parameters.
 */
public class SearchCriteriaDecoder {

    private static final String MATCH_ALL = "1=1";

    public SearchQuery decode(String criteria) throws UnsupportedCriteriaException {
        if (criteria == null || criteria.isBlank() || criteria.trim().equals("*")) {
            return SearchQuery.matchAll();
        }

        String unescaped = criteria
            .replace("&quot;", "\"")
            .replace("&apos;", "'")
            .replace("&amp;", "&");

        Parser parser = new Parser(new Tokenizer(unescaped).tokenize());
        Node tree = parser.parse();

        SearchTable table = selectTable(tree);
        Emitter emitter = new Emitter(table);
        String predicate = emitter.emit(tree);

        LoggerUtil.debug(() -> "[SearchCriteriaDecoder] " + criteria + " -> " + table.getTableName()
            + " WHERE " + predicate + " " + emitter.parameters);
        return new SearchQuery(table, predicate, emitter.parameters, emitter.tags);
    }

    // ==================== Syntax tree ====================

    private interface Node {}

    private record Junction(String operator, Node left, Node right) implements Node {}

    private record Relation(String property, String operator, String value) implements Node {}

    private static SearchTable selectTable(Node node) {
        if (node instanceof Junction junction) {
            SearchTable left = selectTable(junction.left());
            return left != SearchTable.TRACKS ? left : selectTable(junction.right());
        }
        Relation relation = (Relation) node;
        if (!isClassConstraint(relation)) {
            return SearchTable.TRACKS;
        }
        String upnpClass = relation.value().toLowerCase(Locale.ROOT);
        if (upnpClass.startsWith("object.item.videoitem")) {
            return SearchTable.VIDEOS;
        }
        if (upnpClass.startsWith("object.item.imageitem")) {
            return SearchTable.IMAGES;
        }
        return SearchTable.TRACKS;
    }

    private static boolean isClassConstraint(Relation relation) {
        return relation.property().equals("upnp:class")
            && (relation.operator().equals("derivedfrom") || relation.operator().equals("="));
    }

    // ==================== Tokenizer ====================

    private enum TokenType { LPAREN, RPAREN, WORD, STRING }

    private record Token(TokenType type, String text) {}

    private static final class Tokenizer {
        private final String input;
        private int pos;

        Tokenizer(String input) {
            this.input = input;
        }

        List<Token> tokenize() throws UnsupportedCriteriaException {
            List<Token> tokens = new ArrayList<>();
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '(') {
                    tokens.add(new Token(TokenType.LPAREN, "("));
                    pos++;
                } else if (c == ')') {
                    tokens.add(new Token(TokenType.RPAREN, ")"));
                    pos++;
                } else if (c == '"') {
                    tokens.add(new Token(TokenType.STRING, quoted()));
                } else {
                    int start = pos;
                    while (pos < input.length() && !Character.isWhitespace(input.charAt(pos))
                            && "()\"".indexOf(input.charAt(pos)) < 0) {
                        pos++;
                    }
                    tokens.add(new Token(TokenType.WORD, input.substring(start, pos)));
                }
            }
            return tokens;
        }

        private String quoted() throws UnsupportedCriteriaException {
            StringBuilder value = new StringBuilder();
            pos++; // opening quote
            while (pos < input.length()) {
                char c = input.charAt(pos++);
                if (c == '\\' && pos < input.length()) {
                    value.append(input.charAt(pos++));
                } else if (c == '"') {
                    return value.toString();
                } else {
                    value.append(c);
                }
            }
            throw new UnsupportedCriteriaException("unterminated string in search criteria");
        }
    }

    // ==================== Parser ====================

    private static final class Parser {
        private final List<Token> tokens;
        private int pos;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        Node parse() throws UnsupportedCriteriaException {
            Node node = orExpression();
            if (pos != tokens.size()) {
                throw new UnsupportedCriteriaException("unexpected '" + tokens.get(pos).text() + "'");
            }
            return node;
        }

        private Node orExpression() throws UnsupportedCriteriaException {
            Node node = andExpression();
            while (peekWord("or")) {
                pos++;
                node = new Junction("OR", node, andExpression());
            }
            return node;
        }

        private Node andExpression() throws UnsupportedCriteriaException {
            Node node = primary();
            while (peekWord("and")) {
                pos++;
                node = new Junction("AND", node, primary());
            }
            return node;
        }

        private Node primary() throws UnsupportedCriteriaException {
            Token token = next();
            if (token.type() == TokenType.LPAREN) {
                Node inner = orExpression();
                if (next().type() != TokenType.RPAREN) {
                    throw new UnsupportedCriteriaException("missing ')'");
                }
                return inner;
            }
            if (token.type() != TokenType.WORD) {
                throw new UnsupportedCriteriaException("expected a property, got '" + token.text() + "'");
            }

            Token operator = next();
            if (operator.type() != TokenType.WORD) {
                throw new UnsupportedCriteriaException("expected an operator after " + token.text());
            }

            Token value = next();
            if (operator.text().equalsIgnoreCase("exists")) {
                if (value.type() != TokenType.WORD) {
                    throw new UnsupportedCriteriaException("exists needs true or false");
                }
                return new Relation(token.text(), "exists", value.text().toLowerCase(Locale.ROOT));
            }
            if (value.type() != TokenType.STRING) {
                throw new UnsupportedCriteriaException("expected a quoted value after " + operator.text());
            }
            return new Relation(token.text(), normalizeOperator(operator.text()), value.text());
        }

        private static String normalizeOperator(String operator) throws UnsupportedCriteriaException {
            return switch (operator.toLowerCase(Locale.ROOT)) {
                case "contains" -> "contains";
                case "doesnotcontain" -> "doesNotContain";
                case "startswith" -> "startsWith";
                case "derivedfrom" -> "derivedfrom";
                case "=", "!=", "<", "<=", ">", ">=" -> operator;
                default -> throw new UnsupportedCriteriaException("unknown operator " + operator);
            };
        }

        private boolean peekWord(String word) {
            return pos < tokens.size()
                && tokens.get(pos).type() == TokenType.WORD
                && tokens.get(pos).text().equalsIgnoreCase(word);
        }

        private Token next() throws UnsupportedCriteriaException {
            if (pos >= tokens.size()) {
                throw new UnsupportedCriteriaException("search criteria ended early");
            }
            return tokens.get(pos++);
        }
    }

    // ==================== SQL emission ====================

    private enum ValueKind { TEXT, RAW, NUMBER }

    private record Column(String sql, ValueKind kind) {}

    private static final class Emitter {
        private final SearchTable table;
        private final List<Object> parameters = new ArrayList<>();
        private final Set<Character> tags = new LinkedHashSet<>();

        Emitter(SearchTable table) {
            this.table = table;
        }

        String emit(Node node) throws UnsupportedCriteriaException {
            if (node instanceof Junction junction) {
                return "(" + emit(junction.left()) + " " + junction.operator() + " " + emit(junction.right()) + ")";
            }
            return relation((Relation) node);
        }

        private String relation(Relation relation) throws UnsupportedCriteriaException {
            if (relation.property().equals("upnp:class")) {
                if (isClassConstraint(relation) || relation.operator().equals("exists")) {
                    return MATCH_ALL;
                }
                throw new UnsupportedCriteriaException("unsupported upnp:class operator " + relation.operator());
            }
            if (relation.property().equals("@refID") && relation.operator().equals("exists")) {
                return MATCH_ALL;
            }
            if (relation.operator().equals("derivedfrom")) {
                throw new UnsupportedCriteriaException("derivedfrom only applies to upnp:class");
            }

            Column column = column(relation.property());
            String value = relation.value();

            return switch (relation.operator()) {
                case "exists" -> switch (value) {
                    case "true" -> column.sql() + " IS NOT NULL";
                    case "false" -> column.sql() + " IS NULL";
                    default -> throw new UnsupportedCriteriaException("exists needs true or false, got " + value);
                };
                case "contains" -> like(column, "%" + escapeLike(text(column, value)) + "%", false);
                case "doesNotContain" -> like(column, "%" + escapeLike(text(column, value)) + "%", true);
                case "startsWith" -> like(column, escapeLike(text(column, value)) + "%", false);
                default -> {
                    parameters.add(bound(column, value));
                    yield column.sql() + " " + relation.operator() + " ?";
                }
            };
        }

        private String like(Column column, String pattern, boolean negate) throws UnsupportedCriteriaException {
            if (column.kind() == ValueKind.NUMBER) {
                throw new UnsupportedCriteriaException("text match on numeric property " + column.sql());
            }
            parameters.add(pattern);
            return column.sql() + (negate ? " NOT LIKE ?" : " LIKE ?") + " ESCAPE '\\'";
        }

        private Column column(String property) throws UnsupportedCriteriaException {
            String prefix = table.getTableName() + ".";
            switch (property) {
                case "dc:title":
                    return new Column(prefix + "titlesearch", ValueKind.TEXT);
                case "@id":
                    return new Column(prefix + table.getIdColumn(),
                        table == SearchTable.TRACKS ? ValueKind.NUMBER : ValueKind.RAW);
                case "pv:lastUpdated":
                    tags.add(LibrarySearch.TAG_UPDATED);
                    return new Column(prefix + "updated_time", ValueKind.NUMBER);
                default:
                    break;
            }

            if (table != SearchTable.TRACKS) {
                throw new UnsupportedCriteriaException(property + " cannot be searched on " + table.getTableName());
            }
            return switch (property) {
                case "dc:creator", "upnp:artist" -> audio(LibrarySearch.TAG_ARTIST, "contributors.namesearch");
                case "upnp:album" -> audio(LibrarySearch.TAG_ALBUM, "albums.titlesearch");
                case "upnp:genre" -> audio(LibrarySearch.TAG_GENRE, "genres.namesearch");
                default -> throw new UnsupportedCriteriaException("unsupported search property " + property);
            };
        }

        private Column audio(char tag, String sql) {
            tags.add(tag);
            return new Column(sql, ValueKind.TEXT);
        }

        private static String text(Column column, String value) {
            return column.kind() == ValueKind.TEXT ? value.toUpperCase(Locale.ROOT) : value;
        }

        private static Object bound(Column column, String value) throws UnsupportedCriteriaException {
            return switch (column.kind()) {
                case TEXT -> value.toUpperCase(Locale.ROOT);
                case RAW -> value;
                case NUMBER -> {
                    try {
                        yield Long.parseLong(value.trim());
                    } catch (NumberFormatException e) {
                        throw new UnsupportedCriteriaException("expected a number for " + column.sql() + ", got " + value);
                    }
                }
            };
        }

        private static String escapeLike(String value) {
            return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        }
    }
}
