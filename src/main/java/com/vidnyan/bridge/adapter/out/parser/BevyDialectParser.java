package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.adapter.out.parser.RustSyntax.FunctionHead;
import com.vidnyan.bridge.adapter.out.parser.RustSyntax.StructItem;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.scan.ConstructMatcher;
import com.vidnyan.bridge.domain.scan.DeclarationScanner;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer.Span;
import com.vidnyan.bridge.domain.scan.Lexical;
import com.vidnyan.bridge.domain.scan.ScanContext;
import com.vidnyan.bridge.domain.scan.ScanMatch;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Bevy ECS code: systems, components, resources and plugins, plus the
 * shader handles and system registrations found in their bodies.
 */
@Component
public class BevyDialectParser extends AbstractDialectParser {

    private static final Pattern SYSTEM_PARAMS = Pattern.compile("\\b(Query|Commands|Res|ResMut)\\b");
    private static final Pattern PLUGIN = Pattern.compile("impl\\s+Plugin\\s+for\\s+([A-Za-z_]\\w*)\\s*");
    private static final Pattern BUILD = Pattern.compile("\\bfn\\s+build\\b");
    private static final Pattern SHADER_HANDLE = Pattern.compile(
            "let\\s+(?:mut\\s+)?([A-Za-z_]\\w*)\\s*(?::[^=]*)?=\\s*[^;]*?\\.load(::<\\s*Shader\\s*>)?\\s*\\(\\s*\"([^\"]+)\"\\s*\\)",
            Pattern.DOTALL);
    private static final Pattern SHADER_FILE = Pattern.compile("\\.(wgsl|glsl|vert|frag|comp|spv)$");
    private static final Pattern ADD_SYSTEMS = Pattern.compile("\\.\\s*add_systems\\s*\\(");

    private static final List<ConstructMatcher> DECLARATIONS = List.of(
            BevyDialectParser::use,
            BevyDialectParser::system,
            BevyDialectParser::pluginImpl,
            BevyDialectParser::componentOrResource);

    public BevyDialectParser(ParserProperties properties) {
        super(properties, new DeclarationScanner(DECLARATIONS), RustStatements.decomposer(
                List.of(BevyDialectParser::shaderHandle),
                List.of(BevyDialectParser::addSystems)));
    }

    @Override
    public Dialect dialect() {
        return Dialect.BEVY;
    }

    static Optional<ScanMatch> use(ScanContext context, int cursor, int end) {
        return RustSyntax.useItem(context, cursor, end)
                .map(item -> ScanMatch.of(item.end(),
                        context.node(NodeType.BEVY_USE).field("PATH", item.path()).build()));
    }

    /**
     * Functions whose parameters take ECS system parameters. Other functions are not Bevy constructs.
     */
    static Optional<ScanMatch> system(ScanContext context, int cursor, int end) {
        Optional<FunctionHead> found = RustSyntax.functionHead(context, cursor, end);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        FunctionHead head = found.get();
        if (head.isMalformed()) {
            return Optional.of(ScanMatch.malformed(head.problem()));
        }
        if (!SYSTEM_PARAMS.matcher(head.params()).find()) {
            return Optional.empty();
        }
        Node node = context.node(NodeType.BEVY_SYSTEM)
                .field("NAME", head.name())
                .value("PARAMS", RustSyntax.parameters(context, head.params()))
                .value("RETURN_TYPE", RustSyntax.returnType(context, head.returnType()))
                .statements("BODY", context.decompose(head.body().start(), head.body().end()))
                .build();
        return Optional.of(ScanMatch.of(head.body().after(), node));
    }

    /**
     * {@code impl Plugin for X { fn build(&self, app: &mut App) { ... } }}; BODY holds the build statements.
     */
    static Optional<ScanMatch> pluginImpl(ScanContext context, int cursor, int end) {
        String text = context.text();
        Matcher m = PLUGIN.matcher(text).region(cursor, end);
        if (!Lexical.atKeyword(text, cursor, end, "impl") || !m.lookingAt()) {
            return Optional.empty();
        }
        Optional<Span> body = DelimiterBalancer.braces(text, m.end(), end);
        if (body.isEmpty()) {
            return Optional.of(ScanMatch.malformed("Malformed plugin '" + m.group(1) + "': expected '{ ... }'"));
        }
        Node.Builder node = context.node(NodeType.BEVY_PLUGIN_IMPL).field("NAME", m.group(1));
        Matcher build = BUILD.matcher(text).region(body.get().start(), body.get().end());
        if (build.find()) {
            RustSyntax.functionHead(context, build.start(), body.get().end())
                    .filter(head -> !head.isMalformed())
                    .ifPresent(head -> node.statements("BODY",
                            context.decompose(head.body().start(), head.body().end())));
        }
        return Optional.of(ScanMatch.of(body.get().after(), node.build()));
    }

    static Optional<ScanMatch> componentOrResource(ScanContext context, int cursor, int end) {
        Optional<StructItem> item = RustSyntax.structItem(context, cursor, end);
        if (item.isEmpty()) {
            return Optional.empty();
        }
        StructItem struct = item.get();
        NodeType type;
        if (struct.derives("Component")) {
            type = NodeType.BEVY_COMPONENT;
        } else if (struct.derives("Resource")) {
            type = NodeType.BEVY_RESOURCE;
        } else {
            return Optional.empty();
        }
        if (struct.isMalformed()) {
            return Optional.of(ScanMatch.malformed("Malformed struct '" + struct.name() + "': unbalanced body"));
        }
        String fields = struct.bodyText(context.text());
        Node node = context.node(type)
                .field("NAME", struct.name())
                .value("FIELDS", fields.isEmpty() ? null : context.textNode(fields))
                .build();
        return Optional.of(ScanMatch.of(struct.end(), node));
    }

    /**
     * {@code let handle = server.load("shaders/x.wgsl");} or a {@code load::<Shader>} call.
     */
    static Optional<ScanMatch> shaderHandle(ScanContext context, int cursor, int end) {
        String text = context.text();
        if (!Lexical.atKeyword(text, cursor, end, "let")) {
            return Optional.empty();
        }
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, cursor, end, ';');
        if (semicolon == -1) {
            return Optional.empty();
        }
        Matcher m = SHADER_HANDLE.matcher(text.substring(cursor, semicolon));
        if (!m.lookingAt() || (m.group(2) == null && !SHADER_FILE.matcher(m.group(3)).find())) {
            return Optional.empty();
        }
        Node node = context.node(NodeType.BEVY_SHADER_HANDLE)
                .field("NAME", m.group(1))
                .field("SHADER_PATH", m.group(3))
                .build();
        return Optional.of(ScanMatch.of(semicolon + 1, node));
    }

    /**
     * {@code app.add_systems(Schedule, systems);} into SCHEDULE and SYSTEMS.
     */
    static Optional<ScanMatch> addSystems(ScanContext context, int cursor, int end) {
        String text = context.text();
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, cursor, end, ';');
        if (semicolon == -1) {
            return Optional.empty();
        }
        Matcher m = ADD_SYSTEMS.matcher(text).region(cursor, semicolon);
        if (!m.find()) {
            return Optional.empty();
        }
        Optional<Span> args = DelimiterBalancer.extract(text, m.end() - 1, semicolon, '(', ')');
        int comma = args.map(span -> DelimiterBalancer.indexOfTopLevel(text, span.start(), span.end(), ','))
                .orElse(-1);
        if (comma == -1) {
            return Optional.of(ScanMatch.malformed("Malformed add_systems call: expected (schedule, systems)"));
        }
        String systems = text.substring(comma + 1, args.get().end()).trim();
        Node node = context.node(NodeType.BEVY_ADD_SYSTEMS)
                .field("SCHEDULE", text.substring(args.get().start(), comma).trim())
                .value("SYSTEMS", systems.isEmpty() ? null : context.textNode(systems))
                .build();
        return Optional.of(ScanMatch.of(semicolon + 1, node));
    }
}
