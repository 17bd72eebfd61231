package armscript;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Emitter {
    private static final Logger log = LoggerFactory.getLogger(Emitter.class);

    private final List<Quadruple> code = new ArrayList<>(); // append only, index is the address
    private int labelCount = 0; // keep track of how many labels we have made

    // instruction writer, e.g. emit(Opcode.MOVE, "R1", "90", "base")
    public int emit(Opcode op, String a1, String a2, String result) {
        Quadruple q = new Quadruple(op, a1, a2, result);
        code.add(q);
        log.debug("{}: {}", code.size() - 1, q);
        return code.size() - 1;
    }

    // makes a unique label each time its called, newLabel("loop") creates loop0
    public String newLabel(String prefix) {
        return prefix + (labelCount++);
    }

    public List<Quadruple> code() {
        return Collections.unmodifiableList(code);
    }
}
