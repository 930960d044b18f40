package de.psi.separators.smt;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Vector;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.microsoft.z3.Status;

import de.psi.separators.ast.Model;
import de.psi.separators.ast.Signature;
import de.psi.separators.util.Timer;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.Pair;

/**
 * Runs an external cvc4 on a script and reads back its verdict and model. Every
 * failure of the process itself (missing binary, crash, timeout, garbage output)
 * comes back as {@link Status#UNKNOWN}.
 */
public class Cvc4Solver {
    private static final Logger log = LogManager.getLogger(Cvc4Solver.class);

    public static final String[] ARGS = { "--lang=smtlib2.6", "--finite-model-find", "--full-saturate-quant",
            "--produce-models", "--dump-models" };

    private final String executable;

    public Cvc4Solver(String executable) {
        this.executable = executable;
    }

    /** Whether the executable exists, either as a path or somewhere on PATH. */
    public boolean isPresent() {
        if (executable.contains(File.separator)) return new File(executable).canExecute();
        String path = System.getenv("PATH");
        if (path == null) return false;
        for (String dir : path.split(File.pathSeparator))
            if (new File(dir, executable).canExecute()) return true;
        return false;
    }

    public Pair<Status, Model> solve(SmtScript script, Signature sig, Timer timer) throws Err {
        List<String> command = new Vector<String>();
        command.add(executable);
        for (String a : ARGS) command.add(a);

        File out = null, err = null;
        Process process = null;
        try {
            out = File.createTempFile("cvc4", ".out");
            err = File.createTempFile("cvc4", ".err");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectOutput(out);
            pb.redirectError(err);
            log.debug("starting cvc4 process with: {}", command);
            process = pb.start();
            OutputStream in = process.getOutputStream();
            try {
                in.write(script.toString().getBytes(StandardCharsets.UTF_8));
            } finally {
                in.close();
            }
            if (timer.isUnlimited()) {
                process.waitFor();
            } else if (!process.waitFor(timer.remaining(), TimeUnit.MILLISECONDS)) {
                log.info("cvc4 timed out after {}", timer);
                return new Pair<Status, Model>(Status.UNKNOWN, null);
            }
            List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                log.warn("Received non-zero return code from cvc4: {}\n{}\n{}", process.exitValue(), lines,
                        new String(Files.readAllBytes(err.toPath()), StandardCharsets.UTF_8));
                return new Pair<Status, Model>(Status.UNKNOWN, null);
            }
            return interpret(lines, sig);
        } catch (IOException e) {
            log.error("Could not run " + executable, e);
            return new Pair<Status, Model>(Status.UNKNOWN, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Pair<Status, Model>(Status.UNKNOWN, null);
        } finally {
            if (process != null && process.isAlive()) process.destroyForcibly();
            if (out != null) out.delete();
            if (err != null) err.delete();
        }
    }

    /** Reads the verdict on the first non-empty line and the model following {@code sat}. */
    static Pair<Status, Model> interpret(List<String> lines, Signature sig) throws Err {
        int i = 0;
        while (i < lines.size() && lines.get(i).trim().isEmpty()) i++;
        String first = i < lines.size() ? lines.get(i).trim() : "";
        if (first.equals("unsat")) return new Pair<Status, Model>(Status.UNSATISFIABLE, null);
        if (first.equals("unknown")) return new Pair<Status, Model>(Status.UNKNOWN, null);
        if (first.equals("sat")) {
            Model m = Cvc4ModelParser.parse(sig, lines.subList(i + 1, lines.size()));
            return new Pair<Status, Model>(Status.SATISFIABLE, m);
        }
        log.warn("Unexpected cvc4 output: {}", first);
        return new Pair<Status, Model>(Status.UNKNOWN, null);
    }
}
