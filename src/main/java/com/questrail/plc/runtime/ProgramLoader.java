package com.questrail.plc.runtime;

import com.questrail.plc.lang.StParseException;
import com.questrail.plc.lang.StParser;
import com.questrail.plc.lang.ast.Program;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Loads the Structured Text program at startup.
 *
 * <p>Never fatal: a missing, unreadable or malformed file yields
 * {@link Optional#empty()} and the runtime falls back to the default
 * controller.</p>
 */
public final class ProgramLoader
{
    private static final Logger log = LoggerFactory.getLogger(ProgramLoader.class);

    private final StParser parser;

    public ProgramLoader()
    {
        this(new StParser());
    }

    public ProgramLoader(StParser parser)
    {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public Optional<Program> load(Path path)
    {
        Objects.requireNonNull(path, "path");

        if (!Files.isRegularFile(path)) {
            log.warn("ST file not found: {}", path);
            return Optional.empty();
        }

        log.info("Loading ST program from {}", path);
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            log.error("Error reading ST program {}", path, e);
            return Optional.empty();
        }

        try {
            Program program = parser.parse(source);
            log.info("ST program '{}' loaded: {} variables, {} statements",
                    program.name(), program.variables().size(), program.statements().size());
            return Optional.of(program);
        }
        catch (StParseException e) {
            log.error("Error parsing ST program {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
