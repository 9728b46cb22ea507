package com.example.cvmatch.config;

import com.example.cvmatch.error.MatchingEngineException;
import com.example.cvmatch.model.*;
import com.example.cvmatch.service.*;
import com.example.cvmatch.text.SkillDictionary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.modelcontextprotocol.common.McpTransportContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * CV to job matching engine exposed as a stateless MCP server.
 *
 * <p>Consumers:
 * <ul>
 *   <li><b>Candidate assistants</b> scoring a CV against a posting and asking how to improve it.</li>
 *   <li><b>Recruiting tools</b> running batches of CV/posting pairs.</li>
 *   <li><b>Developer assistants</b> reading the scoring model, record schemas and dictionary.</li>
 * </ul>
 *
 * <p>Transport context headers consumed:
 * <ul>
 *   <li>{@code X-Client-ID}     : calling application, logged with every tool call</li>
 *   <li>{@code X-Correlation-ID}: distributed trace propagation</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class CvMatchMcpConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CvMatchMcpConfiguration.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // =========================================================================
    // TOOL ANNOTATION PRESETS
    // =========================================================================

    /** Pure computation over the arguments: same input, same output. */
    private static final McpSchema.ToolAnnotations READ_ONLY =
            new McpSchema.ToolAnnotations(null, true, false, true, false, false);

    /** Reads or appends to process-local history, so repeated calls differ. */
    private static final McpSchema.ToolAnnotations RECORDING =
            new McpSchema.ToolAnnotations(null, false, false, false, false, false);

    private static final int DEFAULT_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_HISTORY_LIMIT = 20;

    private static final Map<String, Object> RECORD_SCHEMAS = buildRecordSchemas();

    // =========================================================================
    // TOOLS
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncToolSpecification> allTools(
            RequirementExtractor extractor,
            CandidateProfiler profiler,
            CompatibilityScorer scorer,
            AdvisoryGenerator advisor,
            MatchingPipeline pipeline,
            MatchHistoryService history,
            SkillDictionary dictionary,
            MatchingProperties properties) {
        return Stream.of(
                extractionTools(extractor, profiler),
                scoringTools(extractor, profiler, scorer, advisor),
                pipelineTools(pipeline),
                knowledgeTools(history, dictionary, properties)
        ).flatMap(List::stream).toList();
    }

    // ------------------------------------------------------------------ extraction

    private List<McpStatelessServerFeatures.SyncToolSpecification> extractionTools(
            RequirementExtractor extractor, CandidateProfiler profiler) {
        return List.of(

            tool("extractJobRequirements",
                "Extract Job Requirements",
                "Structured requirements of a job posting: required and preferred skills, experience level, " +
                "responsibilities, industry keywords, culture signals and industry category.",
                READ_ONLY,
                schema(Map.of(
                    "jobText",  prop("string", "Plain text of the job posting"),
                    "jobTitle", prop("string", "Job title, if known (optional)"),
                    "company",  prop("string", "Hiring company (optional)")),
                    List.of("jobText")),
                (ctx, req) -> {
                    logCtx(ctx, "extractJobRequirements", str(req, "jobTitle"));
                    return guarded(() -> {
                        JobRequirementProfile profile = extractor.extract(jobPosting(req));
                        return ok(toJson(profile), profile);
                    });
                }),

            tool("profileCandidate",
                "Profile Candidate",
                "Structured profile of a CV: skills, experience level and estimated years, experience bullets. " +
                "Skills already extracted by the caller can be passed and are merged with dictionary matches.",
                READ_ONLY,
                schema(Map.of(
                    "cvText", prop("string", "Plain text of the CV"),
                    "skills", propArray("Pre-extracted skill terms (optional)")),
                    List.of("cvText")),
                (ctx, req) -> {
                    logCtx(ctx, "profileCandidate", null);
                    return guarded(() -> {
                        CandidateProfile profile = profiler.profile(candidateDocument(req));
                        return ok(toJson(profile), profile);
                    });
                })
        );
    }

    // ------------------------------------------------------------------ scoring & advice

    private List<McpStatelessServerFeatures.SyncToolSpecification> scoringTools(
            RequirementExtractor extractor, CandidateProfiler profiler,
            CompatibilityScorer scorer, AdvisoryGenerator advisor) {
        return List.of(

            tool("scoreCompatibility",
                "Score Compatibility",
                "0-100 compatibility score of a CV against a job posting with per-factor scores " +
                "(skill_match, experience_alignment, keyword_coverage, responsibility_alignment), " +
                "matched and missing skills, missing keywords and a verdict. No advice is attached.",
                READ_ONLY,
                pairSchema(),
                (ctx, req) -> {
                    logCtx(ctx, "scoreCompatibility", str(req, "jobTitle"));
                    return guarded(() -> {
                        CompatibilityReport report = scorer.score(
                                extractor.extract(jobPosting(req)), profiler.profile(candidateDocument(req)));
                        return ok(toJson(report), report);
                    });
                }),

            tool("generateOptimizationAdvice",
                "Generate Optimization Advice",
                "Prioritised CV improvement advice for a target posting: skill-gap recommendations with " +
                "learning suggestions, keywords to add, per-section rewrite guidance, tailoring suggestions, " +
                "interview focus areas and ATS tips.",
                READ_ONLY,
                pairSchema(),
                (ctx, req) -> {
                    logCtx(ctx, "generateOptimizationAdvice", str(req, "jobTitle"));
                    return guarded(() -> {
                        JobRequirementProfile job = extractor.extract(jobPosting(req));
                        CandidateProfile candidate = profiler.profile(candidateDocument(req));
                        OptimizationAdvice advice = advisor.advise(scorer.score(job, candidate), job, candidate);
                        return ok(toJson(advice), advice);
                    });
                })
        );
    }

    // ------------------------------------------------------------------ full pipeline

    private List<McpStatelessServerFeatures.SyncToolSpecification> pipelineTools(MatchingPipeline pipeline) {
        return List.of(

            tool("matchCvToJob",
                "Match CV to Job",
                "Full analysis of one CV against one posting: both extracted profiles plus the compatibility " +
                "report with optimization advice attached. The result is also added to the match history.",
                RECORDING,
                schema(Map.of(
                    "jobText",        prop("string",  "Plain text of the job posting"),
                    "cvText",         prop("string",  "Plain text of the CV"),
                    "jobTitle",       prop("string",  "Job title, if known (optional)"),
                    "company",        prop("string",  "Hiring company (optional)"),
                    "skills",         propArray("Pre-extracted candidate skill terms (optional)"),
                    "timeoutSeconds", prop("integer", "Give up after this many seconds, default 30")),
                    List.of("jobText", "cvText")),
                (ctx, req) -> {
                    logCtx(ctx, "matchCvToJob", str(req, "jobTitle"));
                    int timeout = intArg(req, "timeoutSeconds", DEFAULT_TIMEOUT_SECONDS);
                    return guarded(() -> {
                        MatchAnalysis analysis = pipeline.analyze(
                                jobPosting(req), candidateDocument(req), Duration.ofSeconds(Math.max(1, timeout)));
                        return ok(toJson(analysis), analysis);
                    });
                }),

            tool("batchMatch",
                "Batch Match",
                "Analyse many independent CV/posting pairs concurrently. Each pair yields either an analysis " +
                "or a failure with its stage and message; one failing pair never aborts the others.",
                RECORDING,
                schema(Map.of(
                    "pairs", Map.of(
                        "type", "array",
                        "description", "Pairs to analyse",
                        "items", Map.of(
                            "type", "object",
                            "properties", Map.of(
                                "pairId",   prop("string", "Caller's identifier for the pair (optional)"),
                                "jobText",  prop("string", "Plain text of the job posting"),
                                "cvText",   prop("string", "Plain text of the CV"),
                                "jobTitle", prop("string", "Job title (optional)")),
                            "required", List.of("jobText", "cvText")))),
                    List.of("pairs")),
                (ctx, req) -> {
                    List<MatchRequest> requests = batchRequests(args(req).get("pairs"));
                    logCtx(ctx, "batchMatch", requests.size() + " pairs");
                    if (requests.isEmpty()) return err("pairs must be a non-empty array");
                    return guarded(() -> {
                        List<PairingOutcome> outcomes = pipeline.analyzeBatch(requests);
                        Map<String, Object> view = new LinkedHashMap<>();
                        view.put("total",     outcomes.size());
                        view.put("succeeded", outcomes.stream().filter(PairingOutcome::isSuccess).count());
                        view.put("failed",    outcomes.stream().filter(o -> !o.isSuccess()).count());
                        view.put("outcomes",  outcomes);
                        return ok(toJson(view), view);
                    });
                })
        );
    }

    // ------------------------------------------------------------------ engine knowledge

    private List<McpStatelessServerFeatures.SyncToolSpecification> knowledgeTools(
            MatchHistoryService history, SkillDictionary dictionary, MatchingProperties properties) {
        return List.of(

            tool("getMatchHistory",
                "Get Match History",
                "Recent analyses recorded by this server. With a job title, returns that title's analyses " +
                "oldest first plus the score trend, to track how a CV improves across revisions.",
                RECORDING,
                schema(Map.of(
                    "jobTitle", prop("string",  "Only analyses for this job title (optional)"),
                    "limit",    prop("integer", "Maximum entries without a job title, default 20")),
                    List.of()),
                (ctx, req) -> {
                    String title = str(req, "jobTitle");
                    logCtx(ctx, "getMatchHistory", title);
                    if (title == null) {
                        List<MatchHistoryEntry> recent = history.findRecent(intArg(req, "limit", DEFAULT_HISTORY_LIMIT));
                        return ok(toJson(recent), recent);
                    }
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("entries", history.findByJobTitle(title));
                    view.put("trend",   history.scoreTrend(title));
                    return ok(toJson(view), view);
                }),

            tool("getSkillDictionary",
                "Get Skill Dictionary",
                "Skills the engine recognises, with their categories and the dictionary version. " +
                "Optionally filter by category.",
                READ_ONLY,
                schema(Map.of(
                    "category", propEnum("Skill category filter (optional)",
                        Arrays.stream(SkillCategory.values()).map(Enum::name).toArray(String[]::new))),
                    List.of()),
                (ctx, req) -> {
                    String category = str(req, "category");
                    logCtx(ctx, "getSkillDictionary", category);
                    Map<String, Object> view = dictionaryView(dictionary, category);
                    return ok(toJson(view), view);
                }),

            tool("getScoringModel",
                "Get Scoring Model",
                "Factor weights, factor definitions, experience alignment table and verdict thresholds " +
                "used to compute the compatibility score.",
                READ_ONLY,
                schema(Map.of(), List.of()),
                (ctx, req) -> {
                    logCtx(ctx, "getScoringModel", null);
                    Map<String, Object> model = scoringModel(properties, dictionary);
                    return ok(toJson(model), model);
                })
        );
    }

    // =========================================================================
    // STATIC RESOURCES: engine knowledge base
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncResourceSpecification> staticResources(
            MatchingProperties properties, SkillDictionary dictionary) {
        return List.of(

            resource("cvmatch://scoring/model",
                "Scoring Model",
                "Factor weights, definitions and verdict thresholds of the compatibility score.",
                "application/json",
                (ctx, req) -> jsonResource(req.uri(), toJson(scoringModel(properties, dictionary)))),

            resource("cvmatch://schema/job-requirement-profile",
                "Job Requirement Profile Schema",
                "Documented fields of the structured job posting profile.",
                "application/json",
                (ctx, req) -> jsonResource(req.uri(), toJson(RECORD_SCHEMAS.get("JobRequirementProfile")))),

            resource("cvmatch://schema/candidate-profile",
                "Candidate Profile Schema",
                "Documented fields of the structured CV profile.",
                "application/json",
                (ctx, req) -> jsonResource(req.uri(), toJson(RECORD_SCHEMAS.get("CandidateProfile")))),

            resource("cvmatch://schema/compatibility-report",
                "Compatibility Report Schema",
                "Documented fields of the compatibility report and its nested optimization advice.",
                "application/json",
                (ctx, req) -> jsonResource(req.uri(), toJson(RECORD_SCHEMAS.get("CompatibilityReport")))),

            resource("cvmatch://dictionary/summary",
                "Skill Dictionary Summary",
                "Dictionary version and number of recognised skills per category.",
                "application/json",
                (ctx, req) -> {
                    Map<String, Object> summary = new LinkedHashMap<>();
                    summary.put("version",    dictionary.version());
                    summary.put("skillCount", dictionary.skills().size());
                    Map<String, Long> perCategory = new TreeMap<>();
                    dictionary.skills().forEach(s -> perCategory.merge(s.category().name(), 1L, Long::sum));
                    summary.put("perCategory", perCategory);
                    return jsonResource(req.uri(), toJson(summary));
                })
        );
    }

    // =========================================================================
    // RESOURCE TEMPLATES: history-scoped sub-resources
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncResourceTemplateSpecification> resourceTemplates(
            MatchHistoryService history) {
        return List.of(

            template("cvmatch://history/{jobTitle}/trend",
                "Score Trend",
                "Score trajectory of all analyses recorded for one job title.",
                "application/json",
                (ctx, req) -> {
                    String title = URLDecoder.decode(
                            seg(req.uri(), "cvmatch://history/", "/trend"), StandardCharsets.UTF_8);
                    return jsonResource(req.uri(), toJson(history.scoreTrend(title)));
                })
        );
    }

    // =========================================================================
    // PROMPTS
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncPromptSpecification> prompts(MatchingPipeline pipeline) {
        return List.of(

            prompt("cv-optimization-coaching",
                "Coach a candidate on rewriting their CV for a target posting, grounded in the engine's analysis.",
                List.of(
                    arg("jobText",  "Plain text of the target job posting", true),
                    arg("cvText",   "Plain text of the candidate's CV",     true),
                    arg("jobTitle", "Job title, if known",                   false)),
                (ctx, req) -> {
                    Map<String, Object> args = req.arguments() == null ? Map.of() : req.arguments();
                    String jobTitle = str(args, "jobTitle");
                    String analysisJson;
                    try {
                        MatchAnalysis analysis = pipeline.analyze(
                                new JobPosting(str(args, "jobText"), jobTitle, null),
                                CandidateDocument.of(str(args, "cvText")));
                        analysisJson = toJson(analysis.report());
                    } catch (MatchingEngineException e) {
                        analysisJson = "{\"error\": \"" + e.getStage() + ": " + e.getMessage() + "\"}";
                    }
                    return promptResult("CV optimization coaching" + (jobTitle == null ? "" : " for " + jobTitle),
                        """
                        You are a career coach helping a candidate tailor their CV to one job posting.
                        Base every recommendation on the analysis below; do not invent experience the
                        candidate does not have.

                        ## Compatibility analysis
                        %s

                        ## Coaching plan (be specific and actionable):
                        1. **Verdict in plain words**: what the overall score and verdict mean for this application
                        2. **Skill gaps**: address HIGH priority gaps first; say which can be shown from existing work and which need learning
                        3. **Keywords**: where in the CV each missing keyword fits naturally
                        4. **Section rewrites**: concrete rewrites for the summary, skills and experience sections
                        5. **Interview preparation**: the focus areas to rehearse before applying
                        """.formatted(analysisJson));
                })
        );
    }

    // =========================================================================
    // COMPLETIONS
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncCompletionSpecification> completions(MatchHistoryService history) {
        return List.of(

            // jobTitle for cv-optimization-coaching, from titles already analysed
            new McpStatelessServerFeatures.SyncCompletionSpecification(
                new McpSchema.PromptReference("cv-optimization-coaching"),
                (McpTransportContext ctx, McpSchema.CompleteRequest req) -> {
                    if (!"jobTitle".equals(req.argument().name())) return emptyCompletion();
                    String partial = req.argument().value().toLowerCase(Locale.ROOT);
                    List<String> titles = history.findRecent(Integer.MAX_VALUE).stream()
                            .map(MatchHistoryEntry::jobTitle)
                            .filter(t -> t.toLowerCase(Locale.ROOT).contains(partial))
                            .distinct()
                            .limit(5).toList();
                    return new McpSchema.CompleteResult(
                            new McpSchema.CompleteResult.CompleteCompletion(titles, titles.size(), false));
                })
        );
    }

    // =========================================================================
    // BUILDER HELPERS
    // =========================================================================

    @FunctionalInterface
    interface ToolHandler {
        McpSchema.CallToolResult handle(McpTransportContext ctx, McpSchema.CallToolRequest req);
    }

    private McpStatelessServerFeatures.SyncToolSpecification tool(
            String name, String title, String description,
            McpSchema.ToolAnnotations annotations, McpSchema.JsonSchema inputSchema,
            ToolHandler handler) {
        return McpStatelessServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name).title(title).description(description)
                        .inputSchema(inputSchema).annotations(annotations).build())
                .callHandler(handler::handle)
                .build();
    }

    private McpStatelessServerFeatures.SyncResourceSpecification resource(
            String uri, String name, String description, String mimeType,
            java.util.function.BiFunction<McpTransportContext, McpSchema.ReadResourceRequest,
                    McpSchema.ReadResourceResult> handler) {
        return new McpStatelessServerFeatures.SyncResourceSpecification(
                McpSchema.Resource.builder().uri(uri).name(name).description(description).mimeType(mimeType).build(),
                handler);
    }

    private McpStatelessServerFeatures.SyncResourceTemplateSpecification template(
            String uriTemplate, String name, String description, String mimeType,
            java.util.function.BiFunction<McpTransportContext, McpSchema.ReadResourceRequest,
                    McpSchema.ReadResourceResult> handler) {
        return new McpStatelessServerFeatures.SyncResourceTemplateSpecification(
                McpSchema.ResourceTemplate.builder()
                        .uriTemplate(uriTemplate).name(name).description(description).mimeType(mimeType).build(),
                handler);
    }

    private McpStatelessServerFeatures.SyncPromptSpecification prompt(
            String name, String description, List<McpSchema.PromptArgument> args,
            java.util.function.BiFunction<McpTransportContext, McpSchema.GetPromptRequest,
                    McpSchema.GetPromptResult> handler) {
        return new McpStatelessServerFeatures.SyncPromptSpecification(
                new McpSchema.Prompt(name, description, args), handler);
    }

    private static McpSchema.PromptArgument arg(String name, String description, boolean required) {
        return new McpSchema.PromptArgument(name, description, required);
    }

    private static McpSchema.GetPromptResult promptResult(String description, String text) {
        return new McpSchema.GetPromptResult(description,
                List.of(new McpSchema.PromptMessage(McpSchema.Role.USER, new McpSchema.TextContent(text))));
    }

    // =========================================================================
    // CALL RESULT HELPERS
    // =========================================================================

    private McpSchema.CallToolResult ok(String text, Object structured) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), false, structured, null);
    }

    private static McpSchema.CallToolResult err(String message) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(message)), true);
    }

    /** Engine failures become error results carrying the stage; anything else propagates. */
    private static McpSchema.CallToolResult guarded(Supplier<McpSchema.CallToolResult> call) {
        try {
            return call.get();
        } catch (MatchingEngineException e) {
            log.warn("Tool call failed at {} for {}: {}", e.getStage(), e.getInput(), e.getMessage());
            return err("[" + e.getStage() + "] " + e.getMessage());
        }
    }

    // =========================================================================
    // RESOURCE HELPERS
    // =========================================================================

    private McpSchema.ReadResourceResult jsonResource(String uri, String json) {
        return new McpSchema.ReadResourceResult(
                List.of(new McpSchema.TextResourceContents(uri, "application/json", json)));
    }

    private static McpSchema.CompleteResult emptyCompletion() {
        return new McpSchema.CompleteResult(
                new McpSchema.CompleteResult.CompleteCompletion(List.of(), 0, false));
    }

    // =========================================================================
    // SCHEMA HELPERS
    // =========================================================================

    private static McpSchema.JsonSchema schema(Map<String, Object> properties, List<String> required) {
        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    private static McpSchema.JsonSchema pairSchema() {
        return schema(Map.of(
                "jobText",  prop("string", "Plain text of the job posting"),
                "cvText",   prop("string", "Plain text of the CV"),
                "jobTitle", prop("string", "Job title, if known (optional)"),
                "company",  prop("string", "Hiring company (optional)"),
                "skills",   propArray("Pre-extracted candidate skill terms (optional)")),
                List.of("jobText", "cvText"));
    }

    private static Map<String, Object> prop(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    private static Map<String, Object> propArray(String description) {
        return Map.of("type", "array", "description", description, "items", Map.of("type", "string"));
    }

    private static Map<String, Object> propEnum(String description, String... values) {
        return Map.of("type", "string", "description", description, "enum", List.of(values));
    }

    // =========================================================================
    // ARGUMENT EXTRACTION HELPERS
    // =========================================================================

    private static Map<String, Object> args(McpSchema.CallToolRequest req) {
        return req.arguments() == null ? Map.of() : req.arguments();
    }

    private static String str(McpSchema.CallToolRequest req, String key) {
        return str(args(req), key);
    }

    private static String str(Map<String, Object> args, String key) {
        Object v = args.get(key);
        return v instanceof String s ? s : null;
    }

    private static int intArg(McpSchema.CallToolRequest req, String key, int def) {
        Object v = args(req).get(key);
        return v instanceof Number n ? n.intValue() : def;
    }

    private static List<String> strList(Object value) {
        if (!(value instanceof List<?> list)) return List.of();
        return list.stream().filter(String.class::isInstance).map(String.class::cast).toList();
    }

    private static JobPosting jobPosting(McpSchema.CallToolRequest req) {
        return new JobPosting(str(req, "jobText"), str(req, "jobTitle"), str(req, "company"));
    }

    private static CandidateDocument candidateDocument(McpSchema.CallToolRequest req) {
        return new CandidateDocument(str(req, "cvText"), strList(args(req).get("skills")));
    }

    static List<MatchRequest> batchRequests(Object pairs) {
        if (!(pairs instanceof List<?> list)) return List.of();
        List<MatchRequest> out = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> raw)) continue;
            Map<String, Object> pair = new HashMap<>();
            raw.forEach((k, v) -> pair.put(String.valueOf(k), v));
            out.add(new MatchRequest(
                    str(pair, "pairId"),
                    new JobPosting(str(pair, "jobText"), str(pair, "jobTitle"), null),
                    new CandidateDocument(str(pair, "cvText"), strList(pair.get("skills")))));
        }
        return out;
    }

    /** Extracts the variable segment from a resolved URI template. */
    private static String seg(String uri, String prefix, String suffix) {
        String after = uri.startsWith(prefix) ? uri.substring(prefix.length()) : uri;
        return !suffix.isEmpty() && after.contains(suffix)
                ? after.substring(0, after.indexOf(suffix)) : after;
    }

    private void logCtx(McpTransportContext ctx, String tool, String subject) {
        String client = ctx.get("X-Client-ID") instanceof String c ? "client=" + c : "client=unknown";
        String corr   = ctx.get("X-Correlation-ID") instanceof String c ? c : "-";
        log.info("[{}] [corr={}] tool={} subject={}", client, corr, tool, subject);
    }

    private String toJson(Object obj) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            return obj.toString();
        }
    }

    // =========================================================================
    // STATIC KNOWLEDGE BUILDERS
    // =========================================================================

    static Map<String, Object> scoringModel(MatchingProperties properties, SkillDictionary dictionary) {
        Map<String, Object> factors = new LinkedHashMap<>();
        factors.put(ScoringFactor.SKILL_MATCH.key(), factor(properties, ScoringFactor.SKILL_MATCH,
                "100 x matched required / max(1, required), plus up to 10 points for the matched share of preferred skills, capped at 100"));
        factors.put(ScoringFactor.EXPERIENCE_ALIGNMENT.key(), factor(properties, ScoringFactor.EXPERIENCE_ALIGNMENT,
                "100 for the same band, 70 one band apart, 40 two bands apart, 100 when either level is unspecified"));
        factors.put(ScoringFactor.KEYWORD_COVERAGE.key(), factor(properties, ScoringFactor.KEYWORD_COVERAGE,
                "100 x industry keywords found in the CV / max(1, industry keywords)"));
        factors.put(ScoringFactor.RESPONSIBILITY_ALIGNMENT.key(), factor(properties, ScoringFactor.RESPONSIBILITY_ALIGNMENT,
                "Mean best token overlap of each responsibility with any single experience bullet, x 100"));

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("factors", factors);
        model.put("overallScore", "round(sum of weight x factor), each factor rounded first, clamped to 0-100");
        model.put("verdicts", Map.of(
                MatchVerdict.STRONG_MATCH.name(),  ">= 70",
                MatchVerdict.PARTIAL_MATCH.name(), ">= 50",
                MatchVerdict.WEAK_MATCH.name(),    "< 50"));
        model.put("experienceBands", Map.of(
                ExperienceLevel.ENTRY.name(),  "under 2 years",
                ExperienceLevel.MID.name(),    "2 to 4 years",
                ExperienceLevel.SENIOR.name(), "5 years or more"));
        model.put("dictionaryVersion", dictionary.version());
        return model;
    }

    private static Map<String, Object> factor(MatchingProperties properties, ScoringFactor factor, String definition) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("weight", properties.getWeights().weightOf(factor));
        m.put("definition", definition);
        return m;
    }

    static Map<String, Object> dictionaryView(SkillDictionary dictionary, String category) {
        List<Map<String, Object>> skills = dictionary.skills().stream()
                .filter(s -> category == null || s.category().name().equalsIgnoreCase(category))
                .map(s -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("id",       s.id());
                    m.put("name",     s.name());
                    m.put("category", s.category());
                    return m;
                })
                .toList();
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("version",    dictionary.version());
        view.put("skillCount", skills.size());
        view.put("skills",     skills);
        return view;
    }

    // ── Record schema helpers ────────────────────────────────────────────────
    private static Map<String, Object> fld(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    private static Map<String, Object> enumFld(List<String> values) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "enum");
        m.put("values", values);
        return m;
    }

    private static List<String> names(Enum<?>[] values) {
        return Arrays.stream(values).map(Enum::name).toList();
    }

    private static Map<String, Object> recordSchema(String record, String description, Map<String, Object> fields) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("record", record);
        schema.put("description", description);
        schema.put("fields", fields);
        return schema;
    }

    private static Map<String, Object> buildRecordSchemas() {
        Map<String, Object> schemas = new LinkedHashMap<>();

        Map<String, Object> skillFields = new LinkedHashMap<>();
        skillFields.put("id",           fld("string",   "Normalized identifier; equality uses this field only"));
        skillFields.put("name",         fld("string",   "Display name"));
        skillFields.put("category",     enumFld(names(SkillCategory.values())));
        skillFields.put("surfaceForms", fld("string[]", "Spellings seen in the source text"));

        Map<String, Object> jobFields = new LinkedHashMap<>();
        jobFields.put("jobTitle",          fld("string",   "Job title, null when unknown"));
        jobFields.put("company",           fld("string",   "Hiring company, null when unknown"));
        jobFields.put("requiredSkills",    fld("Skill[]",  "Must-have skills, first-occurrence order"));
        jobFields.put("preferredSkills",   fld("Skill[]",  "Nice-to-have skills, never overlapping required"));
        jobFields.put("experienceLevel",   enumFld(names(ExperienceLevel.values())));
        jobFields.put("educationRequirement", fld("string", "Degree or qualification line, null when not stated"));
        jobFields.put("responsibilities",  fld("string[]", "One entry per duty"));
        jobFields.put("industryKeywords",  fld("string[]", "Most frequent multi-word phrases that are not skills"));
        jobFields.put("cultureSignals",    fld("string[]", "Culture phrases found in the posting"));
        jobFields.put("industryCategory",  enumFld(names(IndustryCategory.values())));
        jobFields.put("inferenceDegraded", fld("boolean",  "True when the inference collaborator was unavailable"));
        schemas.put("JobRequirementProfile", recordSchema("JobRequirementProfile",
                "Structured requirements of one job posting.", jobFields));

        Map<String, Object> candidateFields = new LinkedHashMap<>();
        candidateFields.put("skills",            fld("Skill[]",  "Skills found in or supplied with the CV"));
        candidateFields.put("experienceLevel",   enumFld(names(ExperienceLevel.values())));
        candidateFields.put("estimatedYears",    fld("integer",  "Years of experience, null when unknown"));
        candidateFields.put("experienceBullets", fld("string[]", "Items of the experience sections"));
        candidateFields.put("textTerms",         fld("string[]", "Normalized 1-3 word terms used for keyword coverage"));
        candidateFields.put("inferenceDegraded", fld("boolean",  "True when the inference collaborator was unavailable"));
        schemas.put("CandidateProfile", recordSchema("CandidateProfile",
                "Structured profile of one CV.", candidateFields));

        Map<String, Object> reportFields = new LinkedHashMap<>();
        reportFields.put("overallScore",           fld("integer",               "Weighted score 0-100"));
        reportFields.put("factorScores",           fld("map<string,integer>",   "skill_match, experience_alignment, keyword_coverage, responsibility_alignment"));
        reportFields.put("matchedSkills",          fld("Skill[]",               "Required or preferred skills the candidate has"));
        reportFields.put("missingRequiredSkills",  fld("Skill[]",               "Longest names first"));
        reportFields.put("missingPreferredSkills", fld("Skill[]",               "Longest names first"));
        reportFields.put("missingKeywords",        fld("string[]",              "Industry keywords absent from the CV"));
        reportFields.put("responsibilityMatches",  fld("ResponsibilityMatch[]", "Best bullet and overlap per responsibility"));
        reportFields.put("verdict",                enumFld(names(MatchVerdict.values())));
        reportFields.put("advice",                 fld("OptimizationAdvice",    "Present once the advisory stage has run"));
        Map<String, Object> report = recordSchema("CompatibilityReport",
                "Compatibility of one CV with one job posting.", reportFields);

        Map<String, Object> adviceFields = new LinkedHashMap<>();
        adviceFields.put("skillRecommendations",   fld("SkillRecommendation[]", "HIGH for required gaps, then MEDIUM for preferred gaps"));
        adviceFields.put("keywordRecommendations", fld("string[]",              "Lower-cased keywords to add"));
        adviceFields.put("sectionAdvice",          fld("map<string,string[]>",  "summary, skills, experience; empty sections omitted"));
        adviceFields.put("tailoringSuggestions",   fld("string[]",              "How to tailor the CV to this posting"));
        adviceFields.put("interviewFocusAreas",    fld("string[]",              "Topics to prepare for interviews"));
        adviceFields.put("atsTips",                fld("string[]",              "Generic applicant tracking system tips"));

        Map<String, Object> reportWithNested = new LinkedHashMap<>(report);
        reportWithNested.put("nested", Map.of(
                "Skill", recordSchema("Skill", "A normalized competency.", skillFields),
                "OptimizationAdvice", recordSchema("OptimizationAdvice", "CV rewrite guidance.", adviceFields)));
        schemas.put("CompatibilityReport", reportWithNested);

        return Collections.unmodifiableMap(schemas);
    }
}
