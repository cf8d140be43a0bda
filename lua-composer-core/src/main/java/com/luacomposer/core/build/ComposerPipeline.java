package com.luacomposer.core.build;

import com.luacomposer.core.ast.AstParser;
import com.luacomposer.core.ast.LuaAst;
import com.luacomposer.core.ast.LuaAstParser;
import com.luacomposer.core.compose.ComposedModule;
import com.luacomposer.core.compose.CompositionEmitter;
import com.luacomposer.core.compose.CompositionInput;
import com.luacomposer.core.compose.CompositionPlan;
import com.luacomposer.core.compose.CompositionPlanner;
import com.luacomposer.core.discovery.ProjectLayout;
import com.luacomposer.core.discovery.SourceDiscovery;
import com.luacomposer.core.discovery.SourceFile;
import com.luacomposer.core.error.ConfigurationException;
import com.luacomposer.core.graph.DependencyExtractor;
import com.luacomposer.core.graph.DependencyGraph;
import com.luacomposer.core.graph.ModuleGraphBuilder;
import com.luacomposer.core.graph.TopologicalSorter;
import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.model.Module;
import com.luacomposer.core.model.ModuleRole;
import com.luacomposer.core.sanitizer.SanitizationResult;
import com.luacomposer.core.sanitizer.Sanitizer;
import com.luacomposer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a build: discovery, parsing, require extraction, ordering, sanitization
 * and composition.
 *
 * <p>The pipeline does no network I/O and writes nothing; fetched dependencies
 * come in with the {@link BuildRequest} and the composed text goes out in the
 * {@link BuildResult}. Each step fails fast with a
 * {@link com.luacomposer.core.error.ComposerException}.
 */
public class ComposerPipeline {

    private static final Logger log = LoggerFactory.getLogger(ComposerPipeline.class);

    private final SourceDiscovery discovery;
    private final AstParser parser;
    private final DependencyExtractor extractor;
    private final ModuleGraphBuilder graphBuilder;
    private final TopologicalSorter sorter;
    private final Sanitizer sanitizer;
    private final CompositionPlanner planner;
    private final CompositionEmitter emitter;

    public ComposerPipeline() {
        this(new SourceDiscovery(), new LuaAstParser(), new Sanitizer());
    }

    public ComposerPipeline(SourceDiscovery discovery, AstParser parser, Sanitizer sanitizer) {
        this.discovery = discovery;
        this.parser = parser;
        this.extractor = new DependencyExtractor();
        this.graphBuilder = new ModuleGraphBuilder();
        this.sorter = new TopologicalSorter();
        this.sanitizer = sanitizer;
        this.planner = new CompositionPlanner();
        this.emitter = new CompositionEmitter();
    }

    /**
     * Builds the composed script.
     *
     * @param request build inputs
     * @return composed text, module order and warnings
     */
    public BuildResult build(BuildRequest request) {
        ProjectAnalysis analysis = analyze(request);
        List<BuildWarning> warnings = new ArrayList<>(analysis.warnings());
        boolean strict = request.options().strict();
        ProjectLayout layout = analysis.layout();

        ComposedModule namespace = sanitize(analysis.module(layout.namespace().identity()), strict, warnings);
        List<ComposedModule> core = new ArrayList<>();
        for (String identity : analysis.order()) {
            core.add(sanitize(analysis.module(identity), strict, warnings));
        }
        ComposedModule entrypoint = sanitize(analysis.module(layout.entrypoint().identity()), strict, warnings);

        CompositionInput input = new CompositionInput(
            analysis.header() != null ? ComposedModule.verbatim(analysis.header()) : null,
            request.dependencies(),
            namespace,
            core,
            entrypoint,
            analysis.footer() != null ? ComposedModule.verbatim(analysis.footer()) : null,
            request.options().scope(),
            request.options().clock().instant()
        );
        CompositionPlan plan = planner.plan(input);
        String text = emitter.emit(plan);

        log.info("Composed {} core modules into {} lines", core.size(), FileUtils.countLines(text));
        return new BuildResult(text, analysis.order(), warnings);
    }

    /**
     * Discovers, parses and orders the project without sanitizing it.
     *
     * @param request build inputs; dependency content is not used
     * @return parsed modules and core-module order
     */
    public ProjectAnalysis analyze(BuildRequest request) {
        ProjectLayout layout = discovery.discover(request.sourceDirectory(), request.headerFile(),
            request.namespaceFile(), request.entrypointFile(), request.footerFile());

        List<BuildWarning> warnings = new ArrayList<>();
        List<Module> loaded = new ArrayList<>();
        Map<String, Module> modules = new LinkedHashMap<>();
        Module header = null;
        Module footer = null;
        for (SourceFile file : layout.allFiles()) {
            Module module = load(file, warnings);
            loaded.add(module);
            if (file.role() == ModuleRole.HEADER) {
                header = module;
            } else if (file.role() == ModuleRole.FOOTER) {
                footer = module;
            }
            // Discovery keeps .lua identities unique; other files are reachable only by role.
            if (file.isLua()) {
                modules.put(module.identity(), module);
            }
        }

        DependencyGraph graph = graphBuilder.build(loaded, request.externalNames());
        List<String> order = sorter.sort(graph);
        log.info("Resolved module order: {}", order.isEmpty() ? "None" : String.join(", ", order));
        return new ProjectAnalysis(layout, modules, header, footer, graph, order, warnings);
    }

    private Module load(SourceFile file, List<BuildWarning> warnings) {
        String source;
        try {
            source = FileUtils.readString(file.path());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + file.relativePath() + ": " + e.getMessage(), e);
        }

        if (file.role() == ModuleRole.HEADER || file.role() == ModuleRole.FOOTER) {
            return new Module(file.identity(), file.path(), file.relativePath(), file.directoryKey(), file.role(),
                source, null, List.of());
        }

        LuaAst.Chunk chunk = parser.parse(source, file.relativePath());
        DependencyExtractor.Extraction extraction = extractor.extract(chunk, file.relativePath());
        warnings.addAll(extraction.warnings());
        log.debug("Parsed {} ({} requires)", file.relativePath(), extraction.requires().size());
        return new Module(file.identity(), file.path(), file.relativePath(), file.directoryKey(), file.role(),
            source, chunk, extraction.requires());
    }

    private ComposedModule sanitize(Module module, boolean strict, List<BuildWarning> warnings) {
        SanitizationResult result = sanitizer.sanitize(module, strict);
        result.report().throwIfFatal();
        warnings.addAll(result.report().warnings());
        try {
            parser.parse(result.text(), module.relativePath());
        } catch (AstParser.AstParseException e) {
            throw new AstParser.AstParseException("Sanitizing " + module.relativePath()
                + " left invalid Lua, most likely a removed line that was part of a larger statement: "
                + e.getMessage(), e);
        }
        return new ComposedModule(module, result.text());
    }
}
