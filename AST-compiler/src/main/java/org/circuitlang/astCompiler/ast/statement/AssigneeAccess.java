package org.circuitlang.astCompiler.ast.statement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.circuitlang.astCompiler.ast.AstNode;
import org.circuitlang.astCompiler.ast.PositiveNumber;
import org.circuitlang.astCompiler.ast.Span;
import org.circuitlang.astCompiler.ast.expression.Expression;
import org.circuitlang.astCompiler.ast.expression.Identifier;
import org.circuitlang.astCompiler.compiler.reducer.ReconstructingDirector;
import org.circuitlang.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Objects;

/** One step in the path of an assignment target, as in a[0].f.1 = ... */
public abstract class AssigneeAccess extends AstNode {
    protected AssigneeAccess(Span span) {
        super(span);
    }

    public abstract AssigneeAccess reconstruct(ReconstructingDirector director);

    /** [left..right] */
    public static final class ArrayRange extends AssigneeAccess {
        @Nullable
        public final Expression left;
        @Nullable
        public final Expression right;

        public ArrayRange(@Nullable Expression left, @Nullable Expression right) {
            super(Span.NONE);
            this.left = left;
            this.right = right;
        }

        @Override
        public AssigneeAccess reconstruct(ReconstructingDirector director) {
            return director.reduceAssigneeArrayRange(this);
        }

        @Override
        protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
            result.set("left", nullableToJson(this.left, mapper));
            result.set("right", nullableToJson(this.right, mapper));
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            builder.append("[");
            if (this.left != null)
                builder.append(this.left);
            builder.append("..");
            if (this.right != null)
                builder.append(this.right);
            return builder.append("]");
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            ArrayRange that = (ArrayRange) o;
            return Objects.equals(this.left, that.left) && Objects.equals(this.right, that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.left, this.right);
        }
    }

    /** [index] */
    public static final class ArrayIndex extends AssigneeAccess {
        public final Expression index;

        public ArrayIndex(Expression index) {
            super(Span.NONE);
            this.index = index;
        }

        @Override
        public AssigneeAccess reconstruct(ReconstructingDirector director) {
            return director.reduceAssigneeArrayIndex(this);
        }

        @Override
        protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
            result.set("index", this.index.toJson(mapper));
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append("[")
                    .append(this.index)
                    .append("]");
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            return this.index.equals(((ArrayIndex) o).index);
        }

        @Override
        public int hashCode() {
            return this.index.hashCode();
        }
    }

    /** .index */
    public static final class Tuple extends AssigneeAccess {
        public final PositiveNumber index;

        public Tuple(PositiveNumber index, Span span) {
            super(span);
            this.index = index;
        }

        @Override
        public AssigneeAccess reconstruct(ReconstructingDirector director) {
            return director.reduceAssigneeTuple(this);
        }

        @Override
        protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
            result.put("index", this.index.value);
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append(".")
                    .append(this.index.value);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            Tuple that = (Tuple) o;
            return this.index.equals(that.index) && this.span.equals(that.span);
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.index, this.span);
        }
    }

    /** .name */
    public static final class Member extends AssigneeAccess {
        public final Identifier name;

        public Member(Identifier name) {
            super(Span.NONE);
            this.name = name;
        }

        @Override
        public AssigneeAccess reconstruct(ReconstructingDirector director) {
            return director.reduceAssigneeMember(this);
        }

        @Override
        protected void fieldsAsJson(ObjectNode result, ObjectMapper mapper) {
            result.set("name", this.name.toJson(mapper));
        }

        @Override
        public IIndentStream toString(IIndentStream builder) {
            return builder.append(".")
                    .append(this.name);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            return this.name.equals(((Member) o).name);
        }

        @Override
        public int hashCode() {
            return this.name.hashCode();
        }
    }
}
