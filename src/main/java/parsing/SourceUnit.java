package parsing;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.BlockStmt;

import java.util.Objects;

/**
 * A parsed unit of source: either a whole compilation unit or a script snippet,
 * i.e. statements without an enclosing class.
 */
public final class SourceUnit {
    private final CompilationUnit compilationUnit;
    private final BlockStmt script;

    private SourceUnit(CompilationUnit compilationUnit, BlockStmt script) {
        this.compilationUnit = compilationUnit;
        this.script = script;
    }

    public static SourceUnit ofCompilationUnit(CompilationUnit cu) {
        return new SourceUnit(Objects.requireNonNull(cu), null);
    }

    public static SourceUnit ofScript(BlockStmt block) {
        return new SourceUnit(null, Objects.requireNonNull(block));
    }

    public boolean isScript() {
        return script != null;
    }

    public CompilationUnit getCompilationUnit() {
        if (compilationUnit == null) {
            throw new IllegalStateException("Source unit is a script");
        }
        return compilationUnit;
    }

    public BlockStmt getScript() {
        if (script == null) {
            throw new IllegalStateException("Source unit is a compilation unit");
        }
        return script;
    }

    public Node root() {
        return isScript() ? script : compilationUnit;
    }
}
