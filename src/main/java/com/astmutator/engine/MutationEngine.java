package com.astmutator.engine;

import com.astmutator.config.MutatorProperties;
import com.astmutator.mutation.CancellationSignal;
import com.astmutator.mutation.GenerationReport;
import com.astmutator.mutation.MutationApplier;
import com.astmutator.mutation.MutationCallback;
import com.astmutator.mutation.MutationGenerator;
import com.astmutator.mutation.MutationOperator;
import com.astmutator.mutation.operators.OperatorRegistry;
import com.astmutator.parser.JavaSourceParser;
import com.astmutator.parser.JavaSourcePrinter;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point tying parser, generator and applier together: source text in, one callback
 * per mutated tree out.
 */
@Service
public class MutationEngine {
    private static final Logger log = LoggerFactory.getLogger(MutationEngine.class);

    private final JavaSourceParser parser;
    private final JavaSourcePrinter printer;
    private final MutationApplier applier;
    private final OperatorRegistry registry;
    private final MutatorProperties properties;

    public MutationEngine(JavaSourceParser parser,
                          JavaSourcePrinter printer,
                          MutationApplier applier,
                          OperatorRegistry registry,
                          MutatorProperties properties) {
        this.parser = parser;
        this.printer = printer;
        this.applier = applier;
        this.registry = registry;
        this.properties = properties;
    }

    public List<MutationOperator> configuredOperators() {
        return registry.select(properties.getOperators());
    }

    /**
     * @throws com.github.javaparser.ParseProblemException if the source does not parse
     */
    public CompilationUnit parse(String source) {
        return parser.parse(source);
    }

    public GenerationReport mutate(String source, List<MutationOperator> operators, MutationCallback callback) {
        return mutate(source, operators, new CancellationSignal(), callback);
    }

    public GenerationReport mutate(String source,
                                   List<MutationOperator> operators,
                                   CancellationSignal signal,
                                   MutationCallback callback) {
        return mutate(parse(source), operators, signal, callback);
    }

    public GenerationReport mutate(Node root,
                                   List<MutationOperator> operators,
                                   CancellationSignal signal,
                                   MutationCallback callback) {
        MutationGenerator generator = new MutationGenerator(operators, applier, properties.getTraversalOrder());
        Stopwatch stopwatch = Stopwatch.createStarted();
        GenerationReport report = generator.generate(root, signal, callback);
        log.debug("Mutation run finished in {} ms: {}", stopwatch.elapsed(TimeUnit.MILLISECONDS), report);
        return report;
    }

    /**
     * Source of mutant {@code id}, regenerated from scratch. Generation stops as soon as the
     * mutant has been printed.
     */
    public Optional<String> mutant(String source, List<MutationOperator> operators, int id) {
        if (id < 0) {
            return Optional.empty();
        }
        AtomicReference<String> found = new AtomicReference<>();
        CancellationSignal signal = new CancellationSignal();
        mutate(source, operators, signal, (mutation, mutatedRoot) -> {
            if (mutation.getId() == id) {
                found.set(printer.print(mutatedRoot));
                signal.cancel();
            }
        });
        return Optional.ofNullable(found.get());
    }
}
