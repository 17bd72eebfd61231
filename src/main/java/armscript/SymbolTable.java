package armscript;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// one entry per (robot, command), keys compared without case
final class SymbolTable {

    private record Key(String robot, String command) {
        static Key of(String robot, String command) {
            return new Key(robot.toLowerCase(Locale.ROOT), command.toLowerCase(Locale.ROOT));
        }
    }

    // insertion ordered so listings follow the script
    private final Map<Key, Symbol> entries = new LinkedHashMap<>();

    // insert if absent
    boolean declare(Symbol s) {
        return entries.putIfAbsent(Key.of(s.robotId(), s.command()), s) == null;
    }

    // replace any entry with the same key, the new one goes to the end like a fresh insert
    void upsert(Symbol s) {
        Key k = Key.of(s.robotId(), s.command());
        entries.remove(k);
        entries.put(k, s);
    }

    Symbol lookup(String robot, String command) {
        return entries.get(Key.of(robot, command));
    }

    // the declaration row of a robot, or null when it was never declared
    Symbol resolveRobot(String robot) {
        return lookup(robot, Symbol.ROBOT);
    }

    boolean isDeclared(String robot) {
        return resolveRobot(robot) != null;
    }

    List<Symbol> snapshot() {
        return List.copyOf(entries.values());
    }

    int size() {
        return entries.size();
    }
}
