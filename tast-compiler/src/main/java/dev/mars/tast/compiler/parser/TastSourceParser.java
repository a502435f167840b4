/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tast.compiler.parser;

import dev.mars.tast.compiler.ast.DataBlock;
import dev.mars.tast.compiler.ast.DataEntry;
import dev.mars.tast.compiler.ast.EdgeDecl;
import dev.mars.tast.compiler.ast.FixtureDecl;
import dev.mars.tast.compiler.ast.GraphDecl;
import dev.mars.tast.compiler.ast.ImportDecl;
import dev.mars.tast.compiler.ast.NodeDecl;
import dev.mars.tast.compiler.ast.QualifiedName;
import dev.mars.tast.compiler.ast.SourceFile;
import dev.mars.tast.compiler.ast.StepDecl;
import dev.mars.tast.compiler.ast.StepKeyword;
import dev.mars.tast.compiler.ast.StepKind;
import dev.mars.tast.compiler.lexer.Lexer;
import dev.mars.tast.compiler.lexer.Token;
import dev.mars.tast.compiler.lexer.TokenStream;
import dev.mars.tast.compiler.lexer.TokenType;
import dev.mars.tast.core.LiteralValue;
import dev.mars.tast.core.SourceSpan;
import dev.mars.tast.core.exceptions.LexException;
import dev.mars.tast.core.exceptions.ParseException;
import dev.mars.tast.core.exceptions.TastException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent implementation of {@link SourceParser} for {@code .tast} files.
 * Stops at the first structural violation with a {@link ParseException} naming
 * the expected construct and the token actually found.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class TastSourceParser implements SourceParser {

    private static final Logger logger = LoggerFactory.getLogger(TastSourceParser.class);

    private final ProseExtractor proseExtractor;

    public TastSourceParser() {
        this(new ProseExtractor());
    }

    public TastSourceParser(ProseExtractor proseExtractor) {
        this.proseExtractor = Objects.requireNonNull(proseExtractor, "Prose extractor cannot be null");
    }

    @Override
    public SourceFile parse(Path file) throws TastException {
        Objects.requireNonNull(file, "File cannot be null");
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return parseFromString(file.toString(), content);
        } catch (IOException e) {
            throw new TastException("Failed to read source file: " + file, e);
        }
    }

    @Override
    public SourceFile parseFromString(String sourceName, String content) throws LexException, ParseException {
        return parse(new TokenStream(sourceName, content));
    }

    @Override
    public SourceFile parse(TokenStream tokens) throws LexException, ParseException {
        Objects.requireNonNull(tokens, "Token stream cannot be null");
        String name = tokens.getSourceName() != null ? tokens.getSourceName() : "<input>";
        SourceFile file = new Session(tokens.open()).parseFile(name);
        logger.debug("Parsed {}: {} import(s), {} fixture(s), {} graph(s)",
                name, file.getImports().size(), file.getFixtures().size(), file.getGraphs().size());
        return file;
    }

    /**
     * State for parsing one file, with a single token of lookahead.
     */
    private final class Session {
        private final Lexer lexer;
        private Token current;
        private Token previous;

        Session(Lexer lexer) throws LexException {
            this.lexer = lexer;
            this.current = lexer.nextToken();
        }

        SourceFile parseFile(String name) throws LexException, ParseException {
            List<ImportDecl> imports = new ArrayList<>();
            List<FixtureDecl> fixtures = new ArrayList<>();
            List<GraphDecl> graphs = new ArrayList<>();

            while (!check(TokenType.EOF)) {
                switch (current.getType()) {
                    case IMPORT:
                        imports.add(parseImport());
                        break;
                    case FIXTURE:
                        fixtures.add(parseFixture());
                        break;
                    case GRAPH:
                        graphs.add(parseGraph());
                        break;
                    default:
                        throw unexpected("'graph', 'import' or 'fixture'");
                }
            }
            return new SourceFile(name, imports, fixtures, graphs);
        }

        private ImportDecl parseImport() throws LexException, ParseException {
            Token start = advance();
            String graphName = expectWord("imported graph name").getText();
            expect(TokenType.FROM, "'from'");
            Token path = expect(TokenType.STRING, "import path string");
            return new ImportDecl(graphName, path.getText(), start.getSpan().merge(path.getSpan()));
        }

        private FixtureDecl parseFixture() throws LexException, ParseException {
            Token start = advance();
            String name = expectWord("fixture name").getText();
            DataBlock data = parseDataBlock();
            return new FixtureDecl(name, data, start.getSpan().merge(previous.getSpan()));
        }

        private GraphDecl parseGraph() throws LexException, ParseException {
            Token start = advance();
            String name = expectWord("graph name").getText();
            expect(TokenType.LBRACE, "'{' after graph name");

            List<NodeDecl> nodes = new ArrayList<>();
            List<EdgeDecl> edges = new ArrayList<>();
            List<FixtureDecl> fixtures = new ArrayList<>();
            List<DataEntry> config = new ArrayList<>();
            SourceSpan configSpan = SourceSpan.unknown();

            while (!check(TokenType.RBRACE)) {
                switch (current.getType()) {
                    case NODE:
                        nodes.add(parseNode());
                        break;
                    case FIXTURE:
                        fixtures.add(parseFixture());
                        break;
                    case CONFIG:
                        advance();
                        match(TokenType.COLON);
                        DataBlock block = parseDataBlock();
                        config.addAll(block.getEntries());
                        configSpan = configSpan.merge(block.getSpan());
                        break;
                    case EOF:
                        throw unexpected("'}' closing graph '" + name + "'");
                    default:
                        if (current.isWord()) {
                            edges.add(parseEdge());
                        } else {
                            throw unexpected("node, edge, fixture or config");
                        }
                        break;
                }
            }
            Token end = advance();
            return new GraphDecl(name, nodes, edges, fixtures, new DataBlock(config, configSpan),
                    start.getSpan().merge(end.getSpan()));
        }

        private NodeDecl parseNode() throws LexException, ParseException {
            Token start = advance();
            String name = expectWord("node name").getText();
            expect(TokenType.LBRACE, "'{' after node name");

            NodeDecl.Builder node = NodeDecl.builder(name);
            StepKind lastKind = null;

            while (!check(TokenType.RBRACE)) {
                TokenType type = current.getType();
                if (type.isStepKeyword()) {
                    StepDecl step = parseStep(lastKind);
                    lastKind = step.getKind();
                    node.step(step);
                    continue;
                }
                switch (type) {
                    case DESCRIBE:
                        advance();
                        node.description(expect(TokenType.STRING, "description string").getText());
                        break;
                    case TAGS:
                        advance();
                        match(TokenType.COLON);
                        node.tags(parseNameList());
                        break;
                    case REQUIRES:
                        advance();
                        match(TokenType.COLON);
                        node.requires(parseNameList());
                        break;
                    case PROVIDES:
                        advance();
                        match(TokenType.COLON);
                        node.provides(parseNameList());
                        break;
                    case CONFIG:
                        advance();
                        match(TokenType.COLON);
                        node.config(parseDataBlock());
                        break;
                    case FIXTURE:
                        advance();
                        Token fixture = expectWord("fixture name");
                        node.attachFixture(DataEntry.spread(fixture.getText(), fixture.getSpan()));
                        break;
                    case EOF:
                        throw unexpected("'}' closing node '" + name + "'");
                    default:
                        throw unexpected("describe, step, tags, requires, provides, config or fixture");
                }
            }
            Token end = advance();
            return node.span(start.getSpan().merge(end.getSpan())).build();
        }

        private StepDecl parseStep(StepKind lastKind) throws LexException, ParseException {
            Token keywordToken = advance();
            StepKeyword keyword = StepKeyword.valueOf(keywordToken.getType().name());
            StepKind kind;
            if (keyword.isContinuation()) {
                if (lastKind == null) {
                    throw new ParseException("a node's steps cannot start with '" + keyword.getText() + "'",
                            keywordToken.getSpan());
                }
                kind = lastKind;
            } else {
                kind = keyword.getKind();
            }

            String text = "";
            SourceSpan span = keywordToken.getSpan();
            if (check(TokenType.FREE_TEXT)) {
                Token freeText = advance();
                text = freeText.getText();
                span = span.merge(freeText.getSpan());
            }
            DataBlock inline = DataBlock.empty();
            if (check(TokenType.LBRACE)) {
                inline = parseDataBlock();
                span = span.merge(inline.getSpan());
            }

            ProseExtractor.Extraction prose = proseExtractor.extract(text);
            return StepDecl.builder()
                    .keyword(keyword)
                    .kind(kind)
                    .text(text)
                    .normalizedText(prose.getNormalizedText())
                    .proseData(prose.getData())
                    .parameters(prose.getParameters())
                    .fixtureReference(prose.getFixtureReference())
                    .inlineData(inline)
                    .span(span)
                    .build();
        }

        private EdgeDecl parseEdge() throws LexException, ParseException {
            QualifiedName source = parseQualifiedName("edge source");
            expect(TokenType.ARROW, "'->' after edge source '" + source + "'");
            QualifiedName target = parseQualifiedName("edge target");

            List<String> passes = new ArrayList<>();
            String description = null;
            List<DataEntry> config = new ArrayList<>();
            SourceSpan configSpan = SourceSpan.unknown();
            SourceSpan span = source.getSpan().merge(target.getSpan());

            if (match(TokenType.LBRACE)) {
                while (!check(TokenType.RBRACE)) {
                    switch (current.getType()) {
                        case PASSES:
                            advance();
                            match(TokenType.COLON);
                            passes.addAll(parseNameList());
                            break;
                        case DESCRIBE:
                            advance();
                            description = expect(TokenType.STRING, "description string").getText();
                            break;
                        case CONFIG:
                            advance();
                            match(TokenType.COLON);
                            DataBlock block = parseDataBlock();
                            config.addAll(block.getEntries());
                            configSpan = configSpan.merge(block.getSpan());
                            break;
                        case EOF:
                            throw unexpected("'}' closing edge " + source + " -> " + target);
                        default:
                            throw unexpected("'passes', 'describe' or 'config'");
                    }
                }
                span = span.merge(advance().getSpan());
            }
            return new EdgeDecl(source, target, passes, description, new DataBlock(config, configSpan), span);
        }

        private QualifiedName parseQualifiedName(String what) throws LexException, ParseException {
            Token first = expectWord(what);
            if (match(TokenType.DOT)) {
                Token second = expectWord("node name after '" + first.getText() + ".'");
                return new QualifiedName(first.getText(), second.getText(), first.getSpan().merge(second.getSpan()));
            }
            return new QualifiedName(null, first.getText(), first.getSpan());
        }

        private List<String> parseNameList() throws LexException, ParseException {
            TokenType close;
            if (match(TokenType.LBRACE)) {
                close = TokenType.RBRACE;
            } else if (match(TokenType.LBRACKET)) {
                close = TokenType.RBRACKET;
            } else {
                throw unexpected("'{' or '['");
            }

            List<String> names = new ArrayList<>();
            while (!check(close)) {
                if (check(TokenType.STRING) || current.isWord()) {
                    names.add(advance().getText());
                } else {
                    throw unexpected("name or " + close.describe());
                }
                match(TokenType.COMMA);
            }
            advance();
            return names;
        }

        private DataBlock parseDataBlock() throws LexException, ParseException {
            Token open = expect(TokenType.LBRACE, "'{' opening data block");
            List<DataEntry> entries = new ArrayList<>();
            while (!check(TokenType.RBRACE)) {
                Token key = check(TokenType.STRING) ? advance() : expectWord("data key or fixture name");
                if (match(TokenType.COLON)) {
                    LiteralValue value = parseValue();
                    entries.add(DataEntry.of(key.getText(), value, key.getSpan().merge(previous.getSpan())));
                } else {
                    entries.add(DataEntry.spread(key.getText(), key.getSpan()));
                }
                match(TokenType.COMMA);
            }
            Token close = advance();
            return new DataBlock(entries, open.getSpan().merge(close.getSpan()));
        }

        private LiteralValue parseValue() throws LexException, ParseException {
            Token token = current;
            switch (token.getType()) {
                case STRING:
                    advance();
                    return LiteralValue.ofString(token.getText());
                case NUMBER:
                    advance();
                    return LiteralValue.ofNumber(token.getText());
                case DURATION:
                    advance();
                    return LiteralValue.ofDuration(token.getText());
                default:
                    if (!token.isWord()) {
                        throw unexpected("value");
                    }
                    advance();
                    switch (token.getText()) {
                        case "true":
                            return LiteralValue.ofBoolean(true);
                        case "false":
                            return LiteralValue.ofBoolean(false);
                        case "null":
                            return LiteralValue.nullValue();
                        default:
                            return LiteralValue.ofString(token.getText());
                    }
            }
        }

        private boolean check(TokenType type) {
            return current.getType() == type;
        }

        private boolean match(TokenType type) throws LexException {
            if (check(type)) {
                advance();
                return true;
            }
            return false;
        }

        private Token advance() throws LexException {
            previous = current;
            if (current.getType() != TokenType.EOF) {
                current = lexer.nextToken();
            }
            return previous;
        }

        private Token expect(TokenType type, String what) throws LexException, ParseException {
            if (!check(type)) {
                throw unexpected(what);
            }
            return advance();
        }

        private Token expectWord(String what) throws LexException, ParseException {
            if (!current.isWord()) {
                throw unexpected(what);
            }
            return advance();
        }

        private ParseException unexpected(String expected) {
            return new ParseException(expected, current.describe(), current.getSpan());
        }
    }
}
