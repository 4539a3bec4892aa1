package io.sagescan.python;

import io.sagescan.python.ast.ClassDef;
import io.sagescan.python.ast.Compare;
import io.sagescan.python.ast.CompoundStmt;
import io.sagescan.python.ast.ExceptHandler;
import io.sagescan.python.ast.FunctionDef;
import io.sagescan.python.ast.ImportFrom;
import io.sagescan.python.ast.Module;
import io.sagescan.python.ast.Param;
import io.sagescan.python.ast.SimpleStmt;
import io.sagescan.python.ast.Try;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonParserTest {

    @Test
    void parse_readsFunctionSignature() throws PythonSyntaxException {
        Module module = PythonParser.parse("def f(a, /, b, *args, c, d=1, **kw):\n    pass\n");

        FunctionDef function = (FunctionDef) module.body().get(0);
        assertThat(function.name()).isEqualTo("f");
        assertThat(function.params()).extracting(Param::name).containsExactly("a", "b", "args", "c", "d", "kw");
        assertThat(function.params()).extracting(Param::kind).containsExactly(
                Param.Kind.POSITIONAL_ONLY,
                Param.Kind.POSITIONAL_OR_KEYWORD,
                Param.Kind.VAR_POSITIONAL,
                Param.Kind.KEYWORD_ONLY,
                Param.Kind.KEYWORD_ONLY,
                Param.Kind.VAR_KEYWORD);
        assertThat(function.params().get(4).hasDefault()).isTrue();
        assertThat(function.positionalOrKeywordParams()).extracting(Param::name).containsExactly("b");
    }

    @Test
    void parse_spansFunctionToLastBodyToken() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                def f(x):
                    y = x + 1

                    return y
                z = 2
                """);

        FunctionDef function = (FunctionDef) module.body().get(0);
        assertThat(function.span().line()).isEqualTo(1);
        assertThat(function.span().endLine()).isEqualTo(4);
        assertThat(module.body()).hasSize(2);
    }

    @Test
    void parse_readsAsyncFunctionAndDecorators() throws PythonSyntaxException {
        Module module = PythonParser.parse("@cache\nasync def fetch(url):\n    return await get(url)\n");

        assertThat(module.body().get(0)).isInstanceOf(SimpleStmt.class);
        FunctionDef function = (FunctionDef) module.body().get(1);
        assertThat(function.async()).isTrue();
        assertThat(function.name()).isEqualTo("fetch");
    }

    @Test
    void parse_readsTryHandlers() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                try:
                    run()
                except (ValueError, KeyError) as e:
                    log(e)
                except:
                    pass
                else:
                    done()
                finally:
                    close()
                """);

        Try tryStmt = (Try) module.body().get(0);
        List<ExceptHandler> handlers = tryStmt.handlers();
        assertThat(handlers).hasSize(2);
        assertThat(handlers.get(0).type()).isEqualTo("(ValueError, KeyError)");
        assertThat(handlers.get(0).alias()).isEqualTo("e");
        assertThat(handlers.get(1).isBare()).isTrue();
        assertThat(handlers.get(1).span().line()).isEqualTo(5);
        assertThat(handlers.get(1).span().endLine()).isEqualTo(6);
        assertThat(tryStmt.orElse()).hasSize(1);
        assertThat(tryStmt.finalBody()).hasSize(1);
    }

    @Test
    void parse_readsRelativeWildcardImport() throws PythonSyntaxException {
        Module module = PythonParser.parse("from ..pkg.sub import *\nfrom . import (a, b)\n");

        ImportFrom wildcard = (ImportFrom) module.body().get(0);
        assertThat(wildcard.module()).isEqualTo("pkg.sub");
        assertThat(wildcard.level()).isEqualTo(2);
        assertThat(wildcard.isWildcard()).isTrue();

        ImportFrom names = (ImportFrom) module.body().get(1);
        assertThat(names.module()).isNull();
        assertThat(names.names()).containsExactly("a", "b");
    }

    @Test
    void parse_readsIfElifElseClauses() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                if a:
                    x()
                elif b == 2:
                    y()
                else:
                    z()
                """);

        CompoundStmt stmt = (CompoundStmt) module.body().get(0);
        assertThat(stmt.clauses()).extracting(c -> c.keyword()).containsExactly("if", "elif", "else");
        assertThat(stmt.clauses().get(1).comparisons()).hasSize(1);
    }

    @Test
    void parse_treatsMatchAsNameOutsideStatementPosition() throws PythonSyntaxException {
        Module module = PythonParser.parse("match = 3\nmatch command:\n    case 'go':\n        go()\n");

        assertThat(module.body().get(0)).isInstanceOf(SimpleStmt.class);
        CompoundStmt match = (CompoundStmt) module.body().get(1);
        assertThat(match.keyword()).isEqualTo("match");
    }

    @Test
    void comparisons_classifiesRightOperand() throws PythonSyntaxException {
        Module module = PythonParser.parse("a = x is 5\nb = x is not 'y'\nc = x is None\nd = x == f'{y}'\ne = x is 5 + y\n");

        List<Compare> compares = module.body().stream()
                .map(s -> ((SimpleStmt) s).comparisons().get(0))
                .toList();
        assertThat(compares).extracting(Compare::operator).containsExactly("is", "is not", "is", "==", "is");
        assertThat(compares).extracting(c -> c.right().kind()).containsExactly(
                Compare.Operand.Kind.NUMBER,
                Compare.Operand.Kind.STRING,
                Compare.Operand.Kind.SINGLETON,
                Compare.Operand.Kind.FSTRING,
                Compare.Operand.Kind.OTHER);
    }

    @Test
    void parse_acceptsTypeParameterLists() throws PythonSyntaxException {
        Module module = PythonParser.parse("""
                def first[T](xs: list[T]) -> T:
                    return xs[0]

                def wrap[K: (str, bytes), *Ts, **P](key, *args):
                    pass

                class Box[T]:
                    def get[U](self, default: U) -> T | U:
                        return default
                """);

        FunctionDef first = (FunctionDef) module.body().get(0);
        assertThat(first.name()).isEqualTo("first");
        assertThat(first.params()).extracting(Param::name).containsExactly("xs");
        assertThat(first.span().endLine()).isEqualTo(2);

        FunctionDef wrap = (FunctionDef) module.body().get(1);
        assertThat(wrap.params()).extracting(Param::name).containsExactly("key", "args");

        ClassDef box = (ClassDef) module.body().get(2);
        assertThat(box.name()).isEqualTo("Box");
        assertThat(box.body()).singleElement().isInstanceOfSatisfying(FunctionDef.class,
                get -> assertThat(get.params()).extracting(Param::name).containsExactly("self", "default"));
    }

    @Test
    void parse_rejectsEmptyTypeParameterList() {
        assertThatThrownBy(() -> PythonParser.parse("def f[](x):\n    pass\n"))
                .isInstanceOf(PythonSyntaxException.class)
                .hasMessage("Type parameter list cannot be empty");
    }

    @Test
    void parse_rejectsMissingIndentedBlock() {
        assertThatThrownBy(() -> PythonParser.parse("def f():\nreturn 1\n"))
                .isInstanceOf(PythonSyntaxException.class)
                .hasMessage("expected an indented block after function definition on line 1");
    }

    @Test
    void parse_rejectsUnexpectedIndent() {
        assertThatThrownBy(() -> PythonParser.parse("x = 1\n    y = 2\n"))
                .isInstanceOf(PythonSyntaxException.class)
                .hasMessage("unexpected indent");
    }

    @Test
    void parse_rejectsMissingColon() {
        assertThatThrownBy(() -> PythonParser.parse("if x\n    pass\n"))
                .isInstanceOf(PythonSyntaxException.class)
                .hasMessage("expected ':'");
    }

    @Test
    void parse_rejectsTryWithoutHandler() {
        assertThatThrownBy(() -> PythonParser.parse("try:\n    x()\ny = 1\n"))
                .isInstanceOf(PythonSyntaxException.class)
                .hasMessage("expected 'except' or 'finally' block");
    }

    @Test
    void parse_rejectsStrayElse() {
        assertThatThrownBy(() -> PythonParser.parse("else:\n    pass\n"))
                .isInstanceOf(PythonSyntaxException.class)
                .hasMessage("invalid syntax");
    }
}
