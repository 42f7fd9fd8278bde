package app.signaltrust.keys.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the command named by the first non-option argument. Without arguments the context starts
 * and stops without doing anything, which is how the store is embedded by other processes.
 */
@Component
public class KeysCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(KeysCommandRunner.class);

    private final KeysCommands commands;
    private int exitCode = KeysCommands.EXIT_OK;

    public KeysCommandRunner(KeysCommands commands) {
        this.commands = commands;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> nonOptionArgs = args.getNonOptionArgs();
        if (nonOptionArgs.isEmpty()) {
            log.info("No command given; available commands: list, validate, import-env");
            return;
        }
        String command = nonOptionArgs.get(0);
        exitCode = commands.execute(
                command,
                nonOptionArgs.subList(1, nonOptionArgs.size()),
                args.containsOption("test-connection"),
                System.out
        );
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
