/*
 * Copyright 2024 The Glue Python Client Authors
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

package io.gluepython.sdk.client.scan;

import io.gluepython.sdk.client.scan.antlr.Python3Lexer;
import io.gluepython.sdk.client.scan.antlr.Python3Parser;
import io.gluepython.sdk.client.scan.antlr.Python3ParserBaseListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.experimental.UtilityClass;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.ParseTreeWalker;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the packages a Python model declares inline with
 * {@code dbt.config(packages=[...])}.
 *
 * <p>This is a fallback for hosts that do not pass the model's
 * {@code packages} config through the parsed model. Source that does not
 * parse yields no packages.
 */
@UtilityClass
public class CodeAnnotationScanner {
    private static final Logger log = LoggerFactory.getLogger(CodeAnnotationScanner.class);

    static final String CONFIG_NAMESPACE = "dbt";
    static final String CONFIG_METHOD = "config";
    static final String PACKAGES_ARGUMENT = "packages";

    /**
     * Returns the string literals of the first {@code dbt.config(packages=[...])}
     * call in the source, in source order.
     *
     * @param sourceText Python source, may be {@code null}
     * @return declared packages, empty when there is no such call or the source does not parse
     */
    public static List<String> extractPackages(String sourceText) {
        return parse(sourceText)
                .flatMap(CodeAnnotationScanner::findDeclaredPackages)
                .orElse(Collections.emptyList());
    }

    static Optional<Python3Parser.File_inputContext> parse(String sourceText) {
        if (sourceText == null) {
            return Optional.empty();
        }

        // the grammar wants every statement terminated by a line break
        final String source = sourceText.stripTrailing() + "\n";
        try {
            final Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(source));
            lexer.removeErrorListeners();
            lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

            final Python3Parser parser = new Python3Parser(new CommonTokenStream(lexer));
            parser.removeErrorListeners();
            parser.addErrorListener(ThrowingErrorListener.INSTANCE);
            parser.setErrorHandler(new BailErrorStrategy());
            return Optional.of(parser.file_input());
        } catch (ParseCancellationException | RecognitionException e) {
            log.debug("Model code is not valid Python, no inline packages extracted: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Failed to parse model code, no inline packages extracted", e);
        }
        return Optional.empty();
    }

    private static Optional<List<String>> findDeclaredPackages(ParseTree tree) {
        final PackagesListener listener = new PackagesListener();
        ParseTreeWalker.DEFAULT.walk(listener, tree);
        return Optional.ofNullable(listener.packages);
    }

    /**
     * Descends through single-child nodes down to an atom, so that only a bare
     * atom without operators, trailers or conditionals is accepted.
     */
    private static Optional<Python3Parser.AtomContext> bareAtom(ParseTree node) {
        ParseTree current = node;
        while (!(current instanceof Python3Parser.AtomContext)) {
            if (current.getChildCount() != 1) {
                return Optional.empty();
            }
            current = current.getChild(0);
        }
        return Optional.of((Python3Parser.AtomContext) current);
    }

    private static Optional<List<String>> listLiteral(Python3Parser.TestContext value) {
        final Optional<Python3Parser.AtomContext> atom = bareAtom(value);
        if (atom.isEmpty() || atom.get().OPEN_BRACK() == null) {
            return Optional.empty();
        }

        final Python3Parser.Testlist_compContext elements = atom.get().testlist_comp();
        if (elements == null) {
            return Optional.of(Collections.emptyList());
        }
        if (elements.comp_for() != null) {
            // a list comprehension, not a literal
            return Optional.empty();
        }

        final List<String> strings = new ArrayList<>();
        for (Python3Parser.Namedexpr_testContext element : elements.namedexpr_test()) {
            if (element.WALRUS() != null) {
                continue;
            }
            bareAtom(element.test(0))
                    .filter(elementAtom -> !elementAtom.STRING().isEmpty())
                    .flatMap(CodeAnnotationScanner::stringConstant)
                    .ifPresent(strings::add);
        }
        return Optional.of(strings);
    }

    private static Optional<String> stringConstant(Python3Parser.AtomContext atom) {
        final StringBuilder value = new StringBuilder();
        for (TerminalNode literal : atom.STRING()) {
            final Optional<String> decoded = PythonStrings.decode(literal.getText());
            if (decoded.isEmpty()) {
                return Optional.empty();
            }
            value.append(decoded.get());
        }
        return Optional.of(value.toString());
    }

    private static final class PackagesListener extends Python3ParserBaseListener {
        private List<String> packages;

        @Override
        public void enterAtom_expr(Python3Parser.Atom_exprContext ctx) {
            if (packages != null) {
                return;
            }

            final Python3Parser.AtomContext atom = ctx.atom();
            if (atom.name() == null || !CONFIG_NAMESPACE.equals(atom.name().getText())) {
                return;
            }
            if (ctx.trailer().size() < 2) {
                return;
            }

            final Python3Parser.TrailerContext attribute = ctx.trailer(0);
            final Python3Parser.TrailerContext call = ctx.trailer(1);
            if (attribute.DOT() == null || !CONFIG_METHOD.equals(attribute.name().getText())) {
                return;
            }
            if (call.OPEN_PAREN() == null || call.arglist() == null) {
                return;
            }

            for (Python3Parser.ArgumentContext argument : call.arglist().argument()) {
                if (argument.ASSIGN() == null || !PACKAGES_ARGUMENT.equals(argument.test(0).getText())) {
                    continue;
                }
                final Optional<List<String>> declared = listLiteral(argument.test(1));
                if (declared.isPresent()) {
                    packages = declared.get();
                    return;
                }
            }
        }
    }

    private static final class ThrowingErrorListener extends BaseErrorListener {
        private static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(
                Recognizer<?, ?> recognizer,
                Object offendingSymbol,
                int line,
                int charPositionInLine,
                String msg,
                RecognitionException e) {
            throw new ParseCancellationException(
                    String.format("line %d:%d %s", line, charPositionInLine, msg));
        }
    }
}
