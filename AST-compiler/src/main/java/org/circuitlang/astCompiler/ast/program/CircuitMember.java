package org.circuitlang.astCompiler.ast.program;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.ast.type.Type;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import java.util.Objects;

/** A member of a circuit declaration. */
public abstract class CircuitMember extends AstNode {
    protected CircuitMember(Span span) {
        super(span);
    }

    public abstract CircuitMember reconstruct(ReconstructingDirector director);

    /** static const name: type = value; its span is the span of the name. */
    public static final class CircuitConst extends CircuitMember {
        public final Identifier name;
        public final Type type;
        public final Expression value;

        public CircuitConst(Identifier name, Type type, Expression value) {
            super(name.span);
            this.name = name;
            this.type = type;
            this.value = value;
        }

        @Override
        public CircuitMember reconstruct(ReconstructingDirector director) {
            return director.reduceCircuitConst(this);
        }

        @Override
        protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
            result.set("name", this.name.toJson(mapper));
            result.set("type", this.type.toJson(mapper));
            result.set("value", this.value.toJson(mapper));
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append("static const ")
                    .append(this.name)
                    .append(": ")
                    .append(this.type)
                    .append(" = ")
                    .append(this.value)
                    .append(";");
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            CircuitConst that = (CircuitConst) o;
            return this.name.equals(that.name) &&
                    this.type.equals(that.type) &&
                    this.value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.name, this.type, this.value);
        }
    }

    /** name: type; its span is the span of the name. */
    public static final class CircuitVariable extends CircuitMember {
        public final Identifier name;
        public final Type type;

        public CircuitVariable(Identifier name, Type type) {
            super(name.span);
            this.name = name;
            this.type = type;
        }

        @Override
        public CircuitMember reconstruct(ReconstructingDirector director) {
            return director.reduceCircuitVariable(this);
        }

        @Override
        protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
            result.set("name", this.name.toJson(mapper));
            result.set("type", this.type.toJson(mapper));
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append(this.name)
                    .append(": ")
                    .append(this.type);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            CircuitVariable that = (CircuitVariable) o;
            return this.name.equals(that.name) && this.type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.name, this.type);
        }
    }

    /** A method; its span is the span of the function. */
    public static final class CircuitFunction extends CircuitMember {
        public final Function function;

        public CircuitFunction(Function function) {
            super(function.span);
            this.function = function;
        }

        @Override
        public CircuitMember reconstruct(ReconstructingDirector director) {
            return director.reduceCircuitFunction(this);
        }

        @Override
        protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
            result.set("function", this.function.toJson(mapper));
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append(this.function);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            return this.function.equals(((CircuitFunction) o).function);
        }

        @Override
        public int hashCode() {
            return this.function.hashCode();
        }
    }
}
