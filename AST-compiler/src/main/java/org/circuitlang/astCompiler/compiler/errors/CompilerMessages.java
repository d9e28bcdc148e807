package org.circuitlang.astCompiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.compiler.AstCompiler;
import org.circuitlang.astCompiler.compiler.IHasSourcePositionRange;
import org.circuitlang.util.Utilities;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Diagnostics collected while running passes.
 * Messages only carry spans; rendering source excerpts is left to the caller. */
public class CompilerMessages {
    public static class Message implements IHasSourcePositionRange {
        public final Span span;
        public final boolean warning;
        public final String errorType;
        public final String message;

        protected Message(Span span, boolean warning, String errorType, String message) {
            this.span = span;
            this.warning = warning;
            this.errorType = errorType;
            this.message = message;
        }

        Message(BaseCompilerException e) {
            this(e.getSpan(), false, e.getErrorKind(),
                    e.getMessage() != null ? e.getMessage() : "");
        }

        Message(Throwable e) {
            this(Span.NONE, false,
                    "This is a bug in the compiler (please report it to the developers)",
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        public void format(StringBuilder output) {
            SourcePositionRange range = this.span.getPositionRange();
            if (range.isValid()) {
                output.append(this.span.getSourceFileName())
                        .append(":")
                        .append(range.start)
                        .append(": ");
            } else if (this.span.isKnown()) {
                output.append(this.span.getSourceFileName())
                        .append(":")
                        .append(this.span)
                        .append(": ");
            }
            if (this.warning)
                output.append("warning:");
            else
                output.append("error:");
            output.append(" ")
                    .append(this.errorType)
                    .append(": ")
                    .append(this.message)
                    .append(System.lineSeparator());
        }

        public JsonNode toJson(ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            this.span.getPositionRange().appendAsJson(result);
            result.put("lo", this.span.lo);
            result.put("hi", this.span.hi);
            result.put("warning", this.warning);
            result.put("error_type", this.errorType);
            result.put("message", this.message);
            return result;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(builder);
            return builder.toString();
        }

        @Override
        public SourcePositionRange getPositionRange() {
            return this.span.getPositionRange();
        }
    }

    public final AstCompiler compiler;
    public final List<Message> messages;
    public int exitCode = 0;

    public CompilerMessages(AstCompiler compiler) {
        this.compiler = compiler;
        this.messages = new ArrayList<>();
    }

    public void clear() {
        this.messages.clear();
        this.exitCode = 0;
    }

    void reportError(Message message) {
        this.messages.add(message);
        if (!message.warning)
            this.exitCode = 1;
    }

    public void reportProblem(Span span, boolean warning, String errorType, String message) {
        this.reportError(new Message(span, warning, errorType, message));
    }

    public void reportError(BaseCompilerException e) {
        this.reportError(new Message(e));
    }

    public void reportError(Throwable e) {
        this.reportError(new Message(e));
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public Message getError(int index) {
        return this.messages.get(index);
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages)
            result.add(message.toJson(mapper));
        return result;
    }

    public void show(PrintStream stream) {
        if (this.errorCount() +
                (this.compiler.options.ioOptions.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    @Override
    public String toString() {
        if (this.compiler.options.ioOptions.emitJsonErrors)
            return this.toJson().toPrettyString();
        StringBuilder builder = new StringBuilder();
        for (Message message: this.messages) {
            if (this.compiler.options.ioOptions.quiet && message.warning)
                continue;
            message.format(builder);
        }
        return builder.toString();
    }
}
