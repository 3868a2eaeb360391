package github.sarthakdev143.animation_studio.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public record PythonModule(List<PythonStatement> body) {

    public PythonModule {
        body = List.copyOf(body);
    }

    /**
     * Every statement in the module, nested ones included, in no particular order.
     */
    public List<PythonStatement> walk() {
        List<PythonStatement> all = new ArrayList<>();
        Deque<PythonStatement> pending = new ArrayDeque<>(body);
        while (!pending.isEmpty()) {
            PythonStatement statement = pending.poll();
            all.add(statement);
            pending.addAll(statement.body());
        }
        return all;
    }
}
