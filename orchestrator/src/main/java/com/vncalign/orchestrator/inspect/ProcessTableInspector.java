package com.vncalign.orchestrator.inspect;

import com.vncalign.orchestrator.config.AlignmentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finds running alignments by walking the OS process table.
 *
 * Two kinds of process are recognised:
 * <ul>
 *   <li>the executor script itself ({@code align_single_cmtk.sh <id>}),
 *       whose first argument is the job id;</li>
 *   <li>the CMTK tools it spawns ({@code registration}, {@code warp}, ...),
 *       whose job id is recovered from an output path of the form
 *       {@code corrected/<id>_xform/...}.</li>
 * </ul>
 * Best effort: processes owned by other users may not expose their
 * arguments, and an id containing "_xform" can be split at the wrong place.
 */
@Component
public class ProcessTableInspector implements LiveJobInspector {

    private static final Logger log = LoggerFactory.getLogger(ProcessTableInspector.class);

    private final Set<String> processNames;
    private final Set<String> toolNames;
    private final Pattern     xformPath;

    public ProcessTableInspector(AlignmentProperties props) {
        this.processNames = Set.copyOf(props.executor().processNames());
        this.toolNames    = Set.copyOf(props.executor().toolNames());
        this.xformPath    = Pattern.compile(
                "(?:^|/)" + Pattern.quote(props.layout().outputDir()) + "/([^/]+)_xform(?:/|$)");
    }

    @Override
    public Set<String> runningJobIds() {
        Set<String> ids = new LinkedHashSet<>();
        try (Stream<ProcessHandle> all = ProcessHandle.allProcesses()) {
            all.filter(ProcessHandle::isAlive)
               .map(ProcessTableInspector::commandLineOf)
               .flatMap(Optional::stream)
               .map(this::jobIdFrom)
               .flatMap(Optional::stream)
               .forEach(ids::add);
        } catch (SecurityException e) {
            log.warn("Process table is not readable: {}", e.getMessage());
        }
        return ids;
    }

    /**
     * Extract the job id from one process's command line, if it belongs to
     * an alignment at all.
     */
    Optional<String> jobIdFrom(List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            if (processNames.contains(fileName(tokens.get(i))) && i + 1 < tokens.size()) {
                String id = stripQuotes(tokens.get(i + 1));
                if (!id.isBlank()) return Optional.of(id);
            }
        }
        if (!tokens.isEmpty() && toolNames.contains(fileName(tokens.get(0)))) {
            for (String token : tokens.subList(1, tokens.size())) {
                Matcher m = xformPath.matcher(stripQuotes(token));
                if (m.find()) return Optional.of(m.group(1));
            }
        }
        return Optional.empty();
    }

    private static Optional<List<String>> commandLineOf(ProcessHandle handle) {
        ProcessHandle.Info info = handle.info();
        Optional<String> command = info.command();
        Optional<String[]> args = info.arguments();
        if (command.isPresent() && args.isPresent()) {
            List<String> tokens = new ArrayList<>();
            tokens.add(command.get());
            tokens.addAll(Arrays.asList(args.get()));
            return Optional.of(tokens);
        }
        return info.commandLine().map(line -> Arrays.asList(line.trim().split("\\s+")));
    }

    private static String fileName(String token) {
        String t = stripQuotes(token);
        return t.substring(t.lastIndexOf('/') + 1);
    }

    private static String stripQuotes(String token) {
        String t = token.trim();
        if (t.length() >= 2 && (t.startsWith("\"") && t.endsWith("\"") || t.startsWith("'") && t.endsWith("'"))) {
            return t.substring(1, t.length() - 1);
        }
        return t;
    }
}
