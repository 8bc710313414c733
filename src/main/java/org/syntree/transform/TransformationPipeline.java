package org.syntree.transform;

import org.syntree.api.StructuralInvariantViolationException;
import org.syntree.api.SyntreeErrorCode;
import org.syntree.api.TransformationException;
import org.syntree.transform.passes.ConstantFoldingPass;
import org.syntree.transform.passes.DeadCodeEliminationPass;
import org.syntree.transform.passes.ExpressionSimplificationPass;
import org.syntree.transform.passes.UnusedVariableRemovalPass;
import org.syntree.tree.AstNode;
import org.syntree.tree.AstNodes;
import org.syntree.tree.TreeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Applies an ordered list of passes to a tree, each pass receiving the output of its predecessor.
 * <p>
 * The input tree and, when enabled, the output of every pass are checked with a
 * {@link TreeValidator}. A structural violation aborts the run with a
 * {@link StructuralInvariantViolationException} naming the pass; any other runtime failure
 * inside a pass aborts it with a {@link TransformationException}. The input tree is never modified.
 */
public class TransformationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(TransformationPipeline.class);

    private final List<TransformPass> passes = new ArrayList<>();
    private final TreeValidator validator;
    private final boolean validateBetweenPasses;

    /**
     * Constructs an empty pipeline with the default validator, validating after every pass.
     */
    public TransformationPipeline() {
        this(new TreeValidator(), true);
    }

    /**
     * Constructs an empty pipeline.
     * @param validator The validator for the input tree and the pass outputs.
     * @param validateBetweenPasses Whether to validate the output of every pass, or only the input.
     */
    public TransformationPipeline(TreeValidator validator, boolean validateBetweenPasses) {
        this.validator = validator;
        this.validateBetweenPasses = validateBetweenPasses;
    }

    /**
     * Creates a pipeline with the given passes in order.
     * @param passes The passes.
     * @return A new pipeline.
     */
    public static TransformationPipeline pipeline(TransformPass... passes) {
        TransformationPipeline pipeline = new TransformationPipeline();
        for (TransformPass pass : passes) {
            pipeline.addPass(pass);
        }
        return pipeline;
    }

    /**
     * Creates a pipeline from registered pass names.
     * @param registry The registry to create the passes from.
     * @param names The pass names in execution order.
     * @return A new pipeline.
     * @throws TransformationException with {@link SyntreeErrorCode#PASS_UNKNOWN} for an unregistered name.
     */
    public static TransformationPipeline fromNames(PassRegistry registry, List<String> names) {
        return fromNames(registry, names, new TreeValidator(), true);
    }

    /**
     * Creates a pipeline from registered pass names with an explicit validation setup.
     * @param registry The registry to create the passes from.
     * @param names The pass names in execution order.
     * @param validator The validator.
     * @param validateBetweenPasses Whether to validate the output of every pass.
     * @return A new pipeline.
     */
    public static TransformationPipeline fromNames(PassRegistry registry, List<String> names,
                                                   TreeValidator validator, boolean validateBetweenPasses) {
        TransformationPipeline pipeline = new TransformationPipeline(validator, validateBetweenPasses);
        for (String name : names) {
            pipeline.addPass(registry.create(name));
        }
        return pipeline;
    }

    /**
     * Appends a pass.
     * @param pass The pass.
     * @return This pipeline.
     */
    public TransformationPipeline addPass(TransformPass pass) {
        passes.add(pass);
        return this;
    }

    /**
     * @param name The pass name.
     * @return The first pass with that name.
     */
    public Optional<TransformPass> getPass(String name) {
        return passes.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Removes every pass with the given name.
     * @param name The pass name.
     * @return {@code true} if a pass was removed.
     */
    public boolean removePass(String name) {
        return passes.removeIf(p -> p.name().equals(name));
    }

    public void clearPasses() {
        passes.clear();
    }

    /**
     * @return The passes in execution order.
     */
    public List<TransformPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * Runs all passes in order.
     * @param tree The input tree; it is left unchanged.
     * @return The output of the last pass, or the input if the pipeline is empty.
     * @throws StructuralInvariantViolationException if the input or a pass output is not a valid tree.
     * @throws TransformationException if a pass fails.
     */
    public AstNode run(AstNode tree) {
        try {
            validator.validate(tree);
        } catch (StructuralInvariantViolationException e) {
            LOG.error("Rejected input tree: {}", e.getMessage());
            throw e;
        }

        long startNanos = System.nanoTime();
        AstNode current = tree;
        for (TransformPass pass : passes) {
            LOG.debug("Running pass '{}'", pass.name());
            current = apply(pass, current);
            LOG.debug("Finished pass '{}'", pass.name());
            if (LOG.isTraceEnabled()) {
                LOG.trace("Tree after '{}':\n{}", pass.name(), AstNodes.dump(current));
            }
        }
        LOG.info("Pipeline finished: {} passes in {} ms", passes.size(), (System.nanoTime() - startNanos) / 1_000_000);
        return current;
    }

    private AstNode apply(TransformPass pass, AstNode input) {
        AstNode output;
        try {
            output = pass.transform(input);
        } catch (StructuralInvariantViolationException e) {
            throw abort(pass, e);
        } catch (TransformationException e) {
            LOG.error("Pass '{}' failed: {}", pass.name(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            LOG.error("Pass '{}' failed", pass.name(), e);
            throw new TransformationException(SyntreeErrorCode.PASS_FAILED, pass.name(),
                    "Pass '" + pass.name() + "' failed: " + e.getMessage(), e);
        }

        if (output == null) {
            throw abort(pass, new StructuralInvariantViolationException(SyntreeErrorCode.TREE_NULL_CHILD,
                    "pass returned no tree"));
        }
        if (validateBetweenPasses) {
            try {
                validator.validate(output);
            } catch (StructuralInvariantViolationException e) {
                throw abort(pass, e);
            }
        }
        return output;
    }

    private StructuralInvariantViolationException abort(TransformPass pass, StructuralInvariantViolationException cause) {
        String message = "Pass '" + pass.name() + "' produced an invalid tree: " + cause.getMessage();
        LOG.error(message);
        return new StructuralInvariantViolationException(message, cause);
    }

    /**
     * Runs the default optimisation sequence: constant folding, expression simplification,
     * dead code elimination and unused variable removal. The passes registered on this
     * pipeline are not used.
     * @param tree The input tree.
     * @return The optimised tree.
     */
    public AstNode optimize(AstNode tree) {
        TransformationPipeline optimizer = new TransformationPipeline(validator, validateBetweenPasses);
        optimizer.addPass(new ConstantFoldingPass())
                .addPass(new ExpressionSimplificationPass())
                .addPass(new DeadCodeEliminationPass())
                .addPass(new UnusedVariableRemovalPass());
        return optimizer.run(tree);
    }
}
