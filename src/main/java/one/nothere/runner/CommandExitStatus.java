package one.nothere.runner;

import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Process exit status reported by the command runners; the highest status recorded wins.
 */
@Component
public class CommandExitStatus implements ExitCodeGenerator {

    static final int SUCCESS = 0;
    static final int FAILURE = 1;

    private final AtomicInteger status = new AtomicInteger(SUCCESS);

    void fail() {
        status.accumulateAndGet(FAILURE, Math::max);
    }

    @Override
    public int getExitCode() {
        return status.get();
    }
}
