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

package io.gluepython.sdk.client.scan.antlr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedList;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

/**
 * Base class of the generated {@code Python3Lexer}.
 *
 * <p>Tracks the indentation stack and bracket nesting so that line breaks
 * become {@code NEWLINE}, {@code INDENT} and {@code DEDENT} tokens the way
 * the Python tokenizer emits them.
 */
public abstract class Python3LexerBase extends Lexer {
    private LinkedList<Token> pending = new LinkedList<>();
    private Deque<Integer> indents = new ArrayDeque<>();
    private int opened = 0;
    private Token lastToken = null;

    protected Python3LexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.setToken(token);
        pending.offer(token);
    }

    @Override
    public Token nextToken() {
        // close every open block before EOF
        if (_input.LA(1) == EOF && !indents.isEmpty()) {
            pending.removeIf(token -> token.getType() == EOF);
            emit(commonToken(Python3Lexer.NEWLINE, "\n"));
            while (!indents.isEmpty()) {
                emit(createDedent());
                indents.pop();
            }
            emit(commonToken(EOF, "<EOF>"));
        }

        final Token next = super.nextToken();
        if (next.getChannel() == Token.DEFAULT_CHANNEL) {
            lastToken = next;
        }
        return pending.isEmpty() ? next : pending.poll();
    }

    @Override
    public void reset() {
        pending = new LinkedList<>();
        indents = new ArrayDeque<>();
        opened = 0;
        lastToken = null;
        super.reset();
    }

    protected boolean atStartOfInput() {
        return getCharPositionInLine() == 0 && getLine() == 1;
    }

    protected void openBrace() {
        opened++;
    }

    protected void closeBrace() {
        opened--;
    }

    protected void onNewLine() {
        final String newLine = getText().replaceAll("[^\r\n\f]+", "");
        final String spaces = getText().replaceAll("[\r\n\f]+", "");

        // blank lines, comment-only lines and breaks inside brackets are not logical line ends
        final int next = _input.LA(1);
        final int nextNext = _input.LA(2);
        if (opened > 0 || (nextNext != EOF && (next == '\r' || next == '\n' || next == '\f' || next == '#'))) {
            skip();
            return;
        }

        emit(commonToken(Python3Lexer.NEWLINE, newLine));
        final int indent = indentationCount(spaces);
        final int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent == previous) {
            skip();
        } else if (indent > previous) {
            indents.push(indent);
            emit(commonToken(Python3Lexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                emit(createDedent());
                indents.pop();
            }
        }
    }

    private Token createDedent() {
        final CommonToken dedent = commonToken(Python3Lexer.DEDENT, "");
        if (lastToken != null) {
            dedent.setLine(lastToken.getLine());
        }
        return dedent;
    }

    private CommonToken commonToken(int type, String text) {
        final int stop = getCharIndex() - 1;
        final int start = text.isEmpty() ? stop : stop - text.length() + 1;
        return new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
    }

    static int indentationCount(String spaces) {
        int count = 0;
        for (char ch : spaces.toCharArray()) {
            if (ch == '\t') {
                count += 8 - (count % 8);
            } else {
                count++;
            }
        }
        return count;
    }
}
