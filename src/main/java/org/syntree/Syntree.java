package org.syntree;

import com.typesafe.config.Config;
import org.syntree.api.QuerySyntaxException;
import org.syntree.api.TreeSerializationException;
import org.syntree.config.LoggingConfigurator;
import org.syntree.config.SyntreeConfig;
import org.syntree.config.SyntreeSettings;
import org.syntree.query.Pattern;
import org.syntree.query.PatternCompiler;
import org.syntree.query.TreeMatcher;
import org.syntree.semantics.SymbolTable;
import org.syntree.semantics.SymbolTableBuilder;
import org.syntree.serialization.NodeJsonCodec;
import org.syntree.transform.PassRegistry;
import org.syntree.transform.TransformationPipeline;
import org.syntree.tree.AstNode;
import org.syntree.tree.TreeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The entry point that wires the components together from one set of settings.
 * <p>
 * A facade instance is immutable after construction apart from the pass registry and the
 * patterns registered on its matcher, which are meant to be filled before use.
 */
public class Syntree {

    private static final Logger LOG = LoggerFactory.getLogger(Syntree.class);

    private final SyntreeSettings settings;
    private final PatternCompiler patternCompiler = new PatternCompiler();
    private final TreeMatcher matcher;
    private final SymbolTableBuilder symbolTableBuilder;
    private final TreeValidator validator;
    private final PassRegistry passRegistry;
    private final NodeJsonCodec codec;

    /**
     * Creates a facade from the merged configuration sources and applies its logging section.
     * @return A new facade.
     */
    public static Syntree create() {
        Config config = SyntreeConfig.load();
        LoggingConfigurator.configure(config);
        return new Syntree(SyntreeSettings.from(config));
    }

    /**
     * Creates a facade with explicit settings.
     * @param settings The settings.
     */
    public Syntree(SyntreeSettings settings) {
        this(settings, PassRegistry.withDefaults(settings.maxDepth()));
    }

    /**
     * Creates a facade with explicit settings and a custom pass registry.
     * @param settings The settings.
     * @param passRegistry The registry the configured pipeline is built from.
     */
    public Syntree(SyntreeSettings settings, PassRegistry passRegistry) {
        this.settings = settings;
        this.matcher = new TreeMatcher(settings.maxDepth());
        this.symbolTableBuilder = new SymbolTableBuilder(settings.builtins(), settings.maxDepth());
        this.validator = new TreeValidator(settings.maxDepth());
        this.passRegistry = passRegistry;
        this.codec = new NodeJsonCodec(settings.maxDepth());
        LOG.debug("Initialised with max depth {} and pipeline {}", settings.maxDepth(), settings.passes());
    }

    public SyntreeSettings getSettings() {
        return settings;
    }

    public TreeMatcher getMatcher() {
        return matcher;
    }

    public PassRegistry getPassRegistry() {
        return passRegistry;
    }

    public NodeJsonCodec getCodec() {
        return codec;
    }

    public Pattern compile(String query) throws QuerySyntaxException {
        return patternCompiler.compile(query);
    }

    public List<AstNode> findMatches(AstNode tree, String query) throws QuerySyntaxException {
        return matcher.findMatches(tree, query);
    }

    public SymbolTable analyze(AstNode tree) {
        return symbolTableBuilder.analyze(tree);
    }

    public void validate(AstNode tree) {
        validator.validate(tree);
    }

    /**
     * Builds a new pipeline from the configured pass names.
     * @return The pipeline.
     */
    public TransformationPipeline pipeline() {
        return TransformationPipeline.fromNames(passRegistry, settings.passes(), validator, settings.validateBetweenPasses());
    }

    /**
     * Runs the configured pipeline.
     * @param tree The input tree.
     * @return The transformed tree.
     */
    public AstNode transform(AstNode tree) {
        return pipeline().run(tree);
    }

    /**
     * Runs the default optimisation sequence.
     * @param tree The input tree.
     * @return The optimised tree.
     */
    public AstNode optimize(AstNode tree) {
        return new TransformationPipeline(validator, settings.validateBetweenPasses()).optimize(tree);
    }

    public String toJson(AstNode tree) throws TreeSerializationException {
        return codec.toJson(tree);
    }

    public AstNode fromJson(String json) throws TreeSerializationException {
        return codec.fromJson(json);
    }
}
