package io.github.cyfko.reverhttp.core.generation;

import io.github.cyfko.reverhttp.core.ast.ArgValue;
import io.github.cyfko.reverhttp.core.ast.Directive;
import io.github.cyfko.reverhttp.core.ast.DirectiveArg;
import io.github.cyfko.reverhttp.core.ir.IrAuth;
import io.github.cyfko.reverhttp.core.ir.IrCache;
import io.github.cyfko.reverhttp.core.ir.IrCors;
import io.github.cyfko.reverhttp.core.ir.IrEtag;

import java.util.List;

/**
 * Lowers {@code cache}, {@code cors} and {@code auth} directives. Shared by route-level directives
 * and the file-level defaults block.
 * <p>
 * Unknown argument names and values of the wrong shape are ignored.
 * </p>
 *
 * @author Frank KOSSI
 * @since 0.1.0
 */
public final class DirectiveLowering {

    public static final String CACHE = "cache";
    public static final String CORS = "cors";
    public static final String AUTH = "auth";

    private DirectiveLowering() {
    }

    /**
     * <pre>
     * cache(max-age: 60, s-maxage: 300, public, no-store, etag: hash(user), last-modified: user.updatedAt, vary: ["Accept"])
     * </pre>
     */
    public static IrCache cache(Directive directive) {
        Integer maxAge = null;
        Integer sMaxage = null;
        String visibility = null;
        Boolean noCache = null;
        Boolean noStore = null;
        IrEtag etag = null;
        String lastModified = null;
        List<String> vary = List.of();

        for (DirectiveArg arg : directive.args()) {
            if (arg.isPositional()) {
                switch (arg.value().text()) {
                    case "public", "private" -> visibility = arg.value().text();
                    case "no-cache" -> noCache = Boolean.TRUE;
                    case "no-store" -> noStore = Boolean.TRUE;
                    default -> { }
                }
                continue;
            }
            switch (arg.name()) {
                case "max-age" -> maxAge = intValue(arg.value(), maxAge);
                case "s-maxage" -> sMaxage = intValue(arg.value(), sMaxage);
                case "etag" -> etag = etag(arg.value());
                case "last-modified" -> lastModified = arg.value().text();
                case "vary" -> vary = listValue(arg.value());
                default -> { }
            }
        }
        return new IrCache(maxAge, sMaxage, visibility, noCache, noStore, etag, lastModified, vary);
    }

    /**
     * <pre>
     * cors(origins: ["https://app.example"], methods: ["GET"], headers: [...], expose-headers: [...], max-age: 600, credentials)
     * </pre>
     */
    public static IrCors cors(Directive directive) {
        List<String> origins = List.of();
        List<String> methods = List.of();
        List<String> headers = List.of();
        List<String> exposeHeaders = List.of();
        Integer maxAge = null;
        Boolean credentials = null;

        for (DirectiveArg arg : directive.args()) {
            if (arg.isPositional()) {
                if ("credentials".equals(arg.value().text())) {
                    credentials = Boolean.TRUE;
                }
                continue;
            }
            switch (arg.name()) {
                case "origins" -> origins = listValue(arg.value());
                case "methods" -> methods = listValue(arg.value());
                case "headers" -> headers = listValue(arg.value());
                case "expose-headers" -> exposeHeaders = listValue(arg.value());
                case "max-age" -> maxAge = intValue(arg.value(), maxAge);
                default -> { }
            }
        }
        return new IrCors(origins, methods, headers, exposeHeaders, maxAge, credentials);
    }

    /**
     * <pre>
     * auth(bearer, roles: ["admin"], permissions: ["users:write"]) as principal
     * </pre>
     * The first positional argument is the scheme; later ones are ignored.
     */
    public static IrAuth auth(Directive directive) {
        String method = null;
        List<String> roles = List.of();
        List<String> permissions = List.of();

        for (DirectiveArg arg : directive.args()) {
            if (arg.isPositional()) {
                if (method == null) {
                    method = arg.value().text();
                }
                continue;
            }
            switch (arg.name()) {
                case "roles" -> roles = listValue(arg.value());
                case "permissions" -> permissions = listValue(arg.value());
                default -> { }
            }
        }
        return new IrAuth(method, roles, permissions, directive.bind());
    }

    private static IrEtag etag(ArgValue value) {
        if (value instanceof ArgValue.Call) {
            ArgValue.Call call = (ArgValue.Call) value;
            return new IrEtag.Function(call.function(), call.argument());
        }
        return new IrEtag.Path(value.text());
    }

    /**
     * Integer literal arguments only; anything else keeps the previous value.
     */
    private static Integer intValue(ArgValue value, Integer previous) {
        if (value instanceof ArgValue.Int) {
            Integer parsed = Numbers.parseInt(value.text());
            return parsed != null ? parsed : previous;
        }
        return previous;
    }

    private static List<String> listValue(ArgValue value) {
        if (value instanceof ArgValue.StringList) {
            return ((ArgValue.StringList) value).items();
        }
        return List.of();
    }
}
