package io.github.cyfko.reverhttp.core.generation;

import io.github.cyfko.reverhttp.core.ast.ArgValue;
import io.github.cyfko.reverhttp.core.ast.ArmAction;
import io.github.cyfko.reverhttp.core.ast.BodyField;
import io.github.cyfko.reverhttp.core.ast.DefaultsBlock;
import io.github.cyfko.reverhttp.core.ast.Directive;
import io.github.cyfko.reverhttp.core.ast.ErrorFlow;
import io.github.cyfko.reverhttp.core.ast.ImportDecl;
import io.github.cyfko.reverhttp.core.ast.MatchArm;
import io.github.cyfko.reverhttp.core.ast.MatchPattern;
import io.github.cyfko.reverhttp.core.ast.PackageArg;
import io.github.cyfko.reverhttp.core.ast.PackageCall;
import io.github.cyfko.reverhttp.core.ast.PipelineStep;
import io.github.cyfko.reverhttp.core.ast.Route;
import io.github.cyfko.reverhttp.core.ast.SourceFile;
import io.github.cyfko.reverhttp.core.ast.StepBody;
import io.github.cyfko.reverhttp.core.ast.TypeDecl;
import io.github.cyfko.reverhttp.core.ir.CorsSetting;
import io.github.cyfko.reverhttp.core.ir.IrAuth;
import io.github.cyfko.reverhttp.core.ir.IrCache;
import io.github.cyfko.reverhttp.core.ir.IrCors;
import io.github.cyfko.reverhttp.core.ir.IrDefaults;
import io.github.cyfko.reverhttp.core.ir.IrDocument;
import io.github.cyfko.reverhttp.core.ir.IrErrorResponse;
import io.github.cyfko.reverhttp.core.ir.IrGuard;
import io.github.cyfko.reverhttp.core.ir.IrGuardStep;
import io.github.cyfko.reverhttp.core.ir.IrImport;
import io.github.cyfko.reverhttp.core.ir.IrInput;
import io.github.cyfko.reverhttp.core.ir.IrMatchArm;
import io.github.cyfko.reverhttp.core.ir.IrMatchBlock;
import io.github.cyfko.reverhttp.core.ir.IrMatchDefault;
import io.github.cyfko.reverhttp.core.ir.IrMatchStep;
import io.github.cyfko.reverhttp.core.ir.IrOutput;
import io.github.cyfko.reverhttp.core.ir.IrPackageStep;
import io.github.cyfko.reverhttp.core.ir.IrPattern;
import io.github.cyfko.reverhttp.core.ir.IrProcess;
import io.github.cyfko.reverhttp.core.ir.IrProcessStep;
import io.github.cyfko.reverhttp.core.ir.IrRoute;
import io.github.cyfko.reverhttp.core.ir.IrTransform;
import io.github.cyfko.reverhttp.core.ir.IrValidate;
import io.github.cyfko.reverhttp.core.ir.IrValidateRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lowers a parsed {@link SourceFile} to an {@link IrDocument}.
 * <p>
 * Generation is total: any tree the parser can produce, including partially recovered ones,
 * yields a document. Missing or ill-shaped parts are left out of the result instead of failing.
 * The generator is stateless and may be shared between threads.
 * </p>
 *
 * <h2>Lowering rules</h2>
 * <ul>
 *   <li>{@code input}, {@code validate}, {@code transform} and {@code respond} fill the route's
 *       sections of the same name; when a route repeats one of them, the last one wins.</li>
 *   <li>Package calls, guards and matches become {@code process} steps, in order.</li>
 *   <li>A transform function named after a primitive type ({@code int}, {@code string},
 *       {@code bool}, {@code float}, {@code datetime}) is a cast; any other name is a function.</li>
 *   <li>{@code cors(none)} yields {@link CorsSetting#DISABLED}; {@code auth(none)} drops auth
 *       from the route.</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public class IrGenerator {

    /**
     * Type names lowered as casts in {@code transform} and as the declared type in {@code validate}.
     */
    public static final Set<String> PRIMITIVE_TYPES = Set.of("int", "string", "bool", "float", "datetime");

    /**
     * Generates the IR of one source unit.
     *
     * @param file the syntax tree
     * @return a fresh document sharing no mutable state with {@code file}
     * @throws NullPointerException if {@code file} is null
     */
    public IrDocument generate(SourceFile file) {
        Objects.requireNonNull(file, "source file cannot be null");

        Map<String, IrImport> imports = new LinkedHashMap<>();
        for (ImportDecl decl : file.imports()) {
            imports.put(decl.alias(), decl.local()
                    ? IrImport.local(decl.source())
                    : IrImport.remote(decl.source(), decl.version()));
        }

        Map<String, Map<String, String>> types = new LinkedHashMap<>();
        for (TypeDecl decl : file.types()) {
            Map<String, String> fields = new LinkedHashMap<>();
            for (TypeDecl.Field field : decl.fields()) {
                fields.put(field.name(), field.typeName());
            }
            types.put(decl.name(), fields);
        }

        IrDefaults defaults = file.defaultsBlock().map(this::generateDefaults).orElse(null);

        List<IrRoute> routes = new ArrayList<>();
        for (Route route : file.routes()) {
            routes.add(generateRoute(route));
        }

        return new IrDocument(IrDocument.CURRENT_VERSION, imports, types, defaults, routes);
    }

    private IrDefaults generateDefaults(DefaultsBlock block) {
        IrCache cache = null;
        IrCors cors = null;
        IrAuth auth = null;
        for (Directive directive : block.directives()) {
            switch (directive.name()) {
                case DirectiveLowering.CACHE -> cache = DirectiveLowering.cache(directive);
                case DirectiveLowering.CORS -> cors = DirectiveLowering.cors(directive);
                case DirectiveLowering.AUTH -> auth = DirectiveLowering.auth(directive);
                default -> { }
            }
        }
        return new IrDefaults(cache, cors, auth);
    }

    private IrRoute generateRoute(Route route) {
        IrAuth auth = null;
        IrCache cache = null;
        CorsSetting cors = CorsSetting.INHERIT;

        for (Directive directive : route.directives()) {
            switch (directive.name()) {
                case DirectiveLowering.CACHE -> cache = DirectiveLowering.cache(directive);
                case DirectiveLowering.CORS -> cors = directive.isDisabled()
                        ? CorsSetting.DISABLED
                        : CorsSetting.of(DirectiveLowering.cors(directive));
                case DirectiveLowering.AUTH -> auth = directive.isDisabled() ? null : DirectiveLowering.auth(directive);
                default -> { }
            }
        }

        RouteSections sections = new RouteSections();
        for (PipelineStep step : route.steps()) {
            step.body().accept(new StepLowering(step, sections));
        }

        return new IrRoute(
                new IrRoute.Endpoint(route.method(), route.path()),
                auth,
                cache,
                cors,
                sections.input,
                sections.validate,
                sections.transform,
                sections.process.isEmpty() ? null : new IrProcess(sections.process),
                sections.output);
    }

    /**
     * Per-route accumulator filled by {@link StepLowering}.
     */
    private static final class RouteSections {
        private Map<String, IrInput> input = Map.of();
        private IrValidate validate;
        private Map<String, IrTransform> transform = Map.of();
        private final List<IrProcessStep> process = new ArrayList<>();
        private IrOutput output;
    }

    /**
     * Lowers one pipeline step into the route sections.
     */
    private static final class StepLowering implements StepBody.Visitor<Void> {

        private final PipelineStep step;
        private final RouteSections sections;

        StepLowering(PipelineStep step, RouteSections sections) {
            this.step = step;
            this.sections = sections;
        }

        @Override
        public Void visitInput(StepBody.Input input) {
            Map<String, IrInput> fields = new LinkedHashMap<>();
            for (StepBody.Input.Field field : input.fields()) {
                fields.put(field.name(), new IrInput(field.source()));
            }
            sections.input = fields;
            return null;
        }

        @Override
        public Void visitValidate(StepBody.Validate validate) {
            Map<String, IrValidateRule> rules = new LinkedHashMap<>();
            for (StepBody.Validate.Rule rule : validate.rules()) {
                rules.put(rule.field(), validateRule(rule));
            }
            sections.validate = new IrValidate(rules, errorResponse(step.errorFlow()));
            return null;
        }

        @Override
        public Void visitTransform(StepBody.Transform transform) {
            Map<String, IrTransform> fields = new LinkedHashMap<>();
            for (StepBody.Transform.Field field : transform.fields()) {
                fields.put(field.name(), PRIMITIVE_TYPES.contains(field.function())
                        ? IrTransform.cast(field.function(), field.source())
                        : IrTransform.function(field.function(), field.source()));
            }
            sections.transform = fields;
            return null;
        }

        @Override
        public Void visitGuard(StepBody.Guard guard) {
            IrGuard condition = guard.negated()
                    ? new IrGuard.Not(guard.expression())
                    : new IrGuard.Expression(guard.expression());
            sections.process.add(new IrGuardStep(condition, errorResponse(step.errorFlow())));
            return null;
        }

        @Override
        public Void visitMatch(StepBody.Match match) {
            List<IrMatchArm> arms = new ArrayList<>();
            IrMatchDefault defaultArm = null;

            for (MatchArm arm : match.arms()) {
                if (arm.isDefault()) {
                    defaultArm = defaultArm(arm);
                } else {
                    arms.add(matchArm(arm, arm.pattern().accept(PatternLowering.INSTANCE)));
                }
            }

            IrMatchBlock block = new IrMatchBlock(match.scrutinee(), arms, defaultArm);
            sections.process.add(new IrMatchStep(step.bind(), block, errorResponse(step.errorFlow())));
            return null;
        }

        @Override
        public Void visitPackageCall(PackageCall call) {
            sections.process.add(new IrPackageStep(step.bind(), call.packageAlias(), packageInput(call),
                    errorResponse(step.errorFlow())));
            return null;
        }

        @Override
        public Void visitRespond(StepBody.Respond respond) {
            sections.output = new IrOutput(Numbers.parseIntOrZero(respond.status()),
                    fieldMap(respond.body()), fieldMap(respond.headers()));
            return null;
        }
    }

    private static IrValidateRule validateRule(StepBody.Validate.Rule rule) {
        String type = null;
        Integer min = null;
        Integer max = null;
        String format = null;

        for (StepBody.Validate.Constraint constraint : rule.constraints()) {
            String name = constraint.name();
            if (PRIMITIVE_TYPES.contains(name)) {
                type = name;
            } else if ("min".equals(name)) {
                min = firstIntArg(constraint, min);
            } else if ("max".equals(name)) {
                max = firstIntArg(constraint, max);
            } else if ("format".equals(name) && !constraint.args().isEmpty()) {
                format = constraint.args().get(0).text();
            }
        }
        return new IrValidateRule(type, min, max, format);
    }

    private static Integer firstIntArg(StepBody.Validate.Constraint constraint, Integer previous) {
        if (constraint.args().isEmpty() || !(constraint.args().get(0) instanceof ArgValue.Int)) {
            return previous;
        }
        Integer value = Numbers.parseInt(constraint.args().get(0).text());
        return value != null ? value : previous;
    }

    /**
     * Default arm: error only, variable reference, or a full arm without pattern.
     */
    private static IrMatchDefault defaultArm(MatchArm arm) {
        switch (arm.action().kind()) {
            case ERROR_ONLY:
                return new IrMatchDefault.ErrorOnly(errorResponse(arm.errorFlow()));
            case REFERENCE:
                return new IrMatchDefault.Reference(((ArmAction.Reference) arm.action()).variable());
            case INVOKE:
            case EMPTY:
            default:
                return matchArm(arm, null);
        }
    }

    private static IrMatchArm matchArm(MatchArm arm, IrPattern pattern) {
        String use = null;
        Map<String, Object> input = Map.of();
        String ref = null;

        switch (arm.action().kind()) {
            case INVOKE:
                PackageCall call = ((ArmAction.Invoke) arm.action()).call();
                use = call.packageAlias();
                input = packageInput(call);
                break;
            case REFERENCE:
                ref = ((ArmAction.Reference) arm.action()).variable();
                break;
            default:
                break;
        }
        return new IrMatchArm(pattern, use, input, errorResponse(arm.errorFlow()), ref);
    }

    /**
     * Keys package-call arguments.
     * <ul>
     *   <li>named: by name</li>
     *   <li>type reference: {@code type}</li>
     *   <li>object shorthand: {@code data}, mapping each field to itself</li>
     *   <li>positional: {@code id} once a {@code type} was recorded, otherwise its own text</li>
     * </ul>
     * A call with several untyped positional values, or several values after the type, is not
     * disambiguated further: later {@code id} values replace earlier ones.
     */
    static Map<String, Object> packageInput(PackageCall call) {
        Map<String, Object> input = new LinkedHashMap<>();
        for (PackageArg arg : call.args()) {
            switch (arg.kind()) {
                case NAMED: {
                    PackageArg.Named named = (PackageArg.Named) arg;
                    input.put(named.name(), named.value());
                    break;
                }
                case TYPE_REF:
                    input.put("type", ((PackageArg.TypeRef) arg).typeName());
                    break;
                case OBJECT_SHORTHAND: {
                    List<String> fields = ((PackageArg.ObjectShorthand) arg).fields();
                    if (fields.isEmpty()) {
                        break;
                    }
                    Map<String, String> data = new LinkedHashMap<>();
                    for (String field : fields) {
                        data.put(field, field);
                    }
                    input.put("data", data);
                    break;
                }
                case POSITIONAL: {
                    String value = ((PackageArg.Positional) arg).value();
                    if (value.isEmpty()) {
                        break;
                    }
                    input.put(input.containsKey("type") ? "id" : value, value);
                    break;
                }
                default:
                    break;
            }
        }
        return input;
    }

    private static IrErrorResponse errorResponse(ErrorFlow flow) {
        if (flow == null) {
            return null;
        }
        return new IrErrorResponse(Numbers.parseIntOrZero(flow.status()), fieldMap(flow.body()));
    }

    private static Map<String, String> fieldMap(List<BodyField> fields) {
        Map<String, String> map = new LinkedHashMap<>();
        for (BodyField field : fields) {
            map.put(field.key(), field.value());
        }
        return map;
    }

    /**
     * Pattern lowering. Literals are tried as integer, then boolean, then {@code null}, then string;
     * multi-value patterns stay strings.
     */
    enum PatternLowering implements MatchPattern.Visitor<IrPattern> {
        INSTANCE;

        @Override
        public IrPattern visitLiteral(MatchPattern.Literal literal) {
            String text = literal.value();
            Integer number = Numbers.parseInt(text);
            if (number != null) {
                return new IrPattern.Value(number);
            }
            if ("true".equals(text) || "false".equals(text)) {
                return new IrPattern.Value(Boolean.valueOf(text));
            }
            if ("null".equals(text)) {
                return new IrPattern.Value(null);
            }
            return new IrPattern.Value(text);
        }

        @Override
        public IrPattern visitMulti(MatchPattern.Multi multi) {
            return new IrPattern.In(multi.values());
        }

        @Override
        public IrPattern visitRange(MatchPattern.Range range) {
            return IrPattern.Range.of(Numbers.parseIntOrZero(range.min()), Numbers.parseIntOrZero(range.max()));
        }

        @Override
        public IrPattern visitRegex(MatchPattern.Regex regex) {
            return new IrPattern.Regex(regex.source());
        }

        @Override
        public IrPattern visitWildcard(MatchPattern.Wildcard wildcard) {
            return null;
        }
    }
}
