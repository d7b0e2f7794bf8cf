package parsing;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.printer.YamlPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns Java source text into a {@link SourceUnit}.
 *
 * The text is first parsed as a compilation unit. When that fails it is parsed again as
 * the body of a block, so plain statement snippets such as {@code z = x + 1;} are accepted.
 */
public class SourceParser {
    private static final Logger logger = LoggerFactory.getLogger(SourceParser.class);

    private final JavaParser parser;

    public SourceParser() {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
        this.parser = new JavaParser(config);
    }

    public SourceUnit parse(String sourceText) throws SourceParseException {
        ParseResult<CompilationUnit> unitResult = parser.parse(sourceText);
        if (unitResult.isSuccessful() && unitResult.getResult().isPresent()) {
            return SourceUnit.ofCompilationUnit(unitResult.getResult().get());
        }

        // newlines keep a trailing line comment from swallowing the closing brace
        ParseResult<BlockStmt> blockResult = parser.parseBlock("{\n" + sourceText + "\n}");
        if (blockResult.isSuccessful() && blockResult.getResult().isPresent()) {
            logger.debug("Parsed source as a statement snippet");
            return SourceUnit.ofScript(blockResult.getResult().get());
        }

        List<String> problems = new ArrayList<>();
        for (Problem problem : blockResult.getProblems()) {
            problems.add(problem.getVerboseMessage());
        }
        logger.warn("Source is neither a compilation unit nor a statement snippet ({} problems)", problems.size());
        throw new SourceParseException("Unable to parse source", problems);
    }

    /** Dumps the AST of a unit as YAML. */
    public String printAst(SourceUnit unit) {
        return new YamlPrinter(true).output(unit.root());
    }
}
