package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.session.ParseSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BevyDialectParserTest {

    private static final String GAME = """
            use bevy::prelude::*;

            #[derive(Component)]
            struct Velocity { x: f32, y: f32 }

            #[derive(Resource, Default)]
            struct Score(u32);

            fn move_system(mut query: Query<(&mut Transform, &Velocity)>) {
                for (mut t, v) in query.iter_mut() {
                    t.translation.x += v.x;
                }
            }

            fn helper() -> u32 { 1 }

            struct GamePlugin;

            impl Plugin for GamePlugin {
                fn build(&self, app: &mut App) {
                    app.add_systems(Update, (move_system, score_system));
                }
            }

            fn setup(mut commands: Commands, asset_server: Res<AssetServer>) {
                let shader = asset_server.load("shaders/blur.wgsl");
                let texture = asset_server.load("textures/icon.png");
                commands.spawn(Camera2dBundle::default());
            }
            """;

    private BevyDialectParser parser;
    private ParseSession session;

    @BeforeEach
    void setUp() {
        parser = new BevyDialectParser(new ParserProperties());
        session = new ParseSession();
    }

    @Test
    void parse_ShouldRecognizeOnlyBevyConstructs() {
        List<Node> nodes = parse(GAME);

        assertEquals(List.of(NodeType.BEVY_USE, NodeType.BEVY_COMPONENT, NodeType.BEVY_RESOURCE,
                        NodeType.BEVY_SYSTEM, NodeType.BEVY_PLUGIN_IMPL, NodeType.BEVY_SYSTEM),
                nodes.stream().map(Node::type).toList());
        assertEquals("bevy::prelude::*", nodes.get(0).field("PATH"));
        assertFalse(session.errors().hasErrors());
    }

    @Test
    void parse_ShouldKeepComponentFieldsAsTextAndOmitThemForTupleResources() {
        List<Node> nodes = parse(GAME);

        assertEquals("Velocity", nodes.get(1).field("NAME"));
        assertEquals("x: f32, y: f32", nodes.get(1).value("FIELDS").field("NAME"));
        assertEquals("Score", nodes.get(2).field("NAME"));
        assertNull(nodes.get(2).value("FIELDS"));
    }

    @Test
    void parse_ShouldBuildSystemWithParametersAndBody() {
        Node system = parse(GAME).get(3);

        assertEquals("move_system", system.field("NAME"));
        assertEquals("mut query: Query<(&mut Transform, &Velocity)>", system.value("PARAMS").field("PARAMS"));
        assertNull(system.value("RETURN_TYPE"));
        Node loop = system.statements("BODY").get(0);
        assertEquals(NodeType.RUST_FOR, loop.type());
        assertEquals("(mut t, v)", loop.field("VAR"));
        assertEquals("query.iter_mut()", loop.value("ITERATOR").field("NAME"));
    }

    @Test
    void parse_ShouldExtractSystemRegistrationsFromPluginBuild() {
        Node plugin = parse(GAME).get(4);

        assertEquals("GamePlugin", plugin.field("NAME"));
        Node registration = plugin.statements("BODY").get(0);
        assertEquals(NodeType.BEVY_ADD_SYSTEMS, registration.type());
        assertEquals("Update", registration.field("SCHEDULE"));
        assertEquals("(move_system, score_system)", registration.value("SYSTEMS").field("NAME"));
    }

    @Test
    void parse_ShouldRecognizeShaderHandlesButNotOtherAssets() {
        List<Node> body = parse(GAME).get(5).statements("BODY");

        assertEquals(List.of(NodeType.BEVY_SHADER_HANDLE, NodeType.RUST_LET_BINDING, NodeType.RUST_EXPR_STMT),
                body.stream().map(Node::type).toList());
        assertEquals("shader", body.get(0).field("NAME"));
        assertEquals("shaders/blur.wgsl", body.get(0).field("SHADER_PATH"));
        assertEquals("texture", body.get(1).field("NAME"));
    }

    @Test
    void parse_ShouldAcceptTypedShaderLoadsWithoutShaderExtension() {
        List<Node> nodes = parse("fn load(server: Res<AssetServer>) {\n"
                + "    let material: Handle<Shader> = server.load::<Shader>(\"embedded://post\");\n"
                + "}");

        Node handle = nodes.get(0).statements("BODY").get(0);
        assertEquals(NodeType.BEVY_SHADER_HANDLE, handle.type());
        assertEquals("material", handle.field("NAME"));
        assertEquals("embedded://post", handle.field("SHADER_PATH"));
    }

    @Test
    void parse_ShouldReportRegistrationWithoutSchedule() {
        List<Node> nodes = parse("fn wire(mut commands: Commands) { app.add_systems(everything); }");

        assertEquals(List.of(), nodes.get(0).statements("BODY"));
        assertEquals("Malformed add_systems call: expected (schedule, systems)",
                session.diagnostics().get(0).message());
    }

    @Test
    void parse_ShouldFallBackToBevyCommentWithoutSystems() {
        List<Node> nodes = parse("fn plain() -> u32 { 1 }");

        assertEquals(1, nodes.size());
        assertEquals(NodeType.BEVY_COMMENT, nodes.get(0).type());
    }

    private List<Node> parse(String text) {
        return parser.parse(text, session).nodes();
    }
}
