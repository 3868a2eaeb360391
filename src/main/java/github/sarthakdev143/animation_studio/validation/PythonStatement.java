package github.sarthakdev143.animation_studio.validation;

import java.util.List;

/**
 * Statement node of a parsed Python module. Only the statement kinds that scene checks
 * inspect get their own node type; everything else is kept as its token run.
 */
public interface PythonStatement {

    int line();

    default List<PythonStatement> body() {
        return List.of();
    }

    record ImportStatement(int line, List<String> modules) implements PythonStatement {

        public ImportStatement {
            modules = List.copyOf(modules);
        }
    }

    record ImportFromStatement(int line, String module, List<String> names) implements PythonStatement {

        public ImportFromStatement {
            names = List.copyOf(names);
        }
    }

    record ClassDefinition(int line, String name, List<String> bases, List<PythonStatement> body)
            implements PythonStatement {

        public ClassDefinition {
            bases = List.copyOf(bases);
            body = List.copyOf(body);
        }
    }

    record FunctionDefinition(int line, String name, boolean async, List<PythonStatement> body)
            implements PythonStatement {

        public FunctionDefinition {
            body = List.copyOf(body);
        }
    }

    record CompoundStatement(int line, String keyword, List<PythonStatement> body) implements PythonStatement {

        public CompoundStatement {
            body = List.copyOf(body);
        }
    }

    record SimpleStatement(int line, List<PythonToken> tokens) implements PythonStatement {

        public SimpleStatement {
            tokens = List.copyOf(tokens);
        }
    }
}
