package org.mapforge.template;

import org.mapforge.junit.extensions.logging.ExpectLog;
import org.mapforge.junit.extensions.logging.LogLevel;
import org.mapforge.junit.extensions.logging.LogWatchExtension;
import org.mapforge.map.Entity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TemplateLibraryTest {

    @Test
    @DisplayName("Templates are grouped by id and visgroup")
    void groupsById() {
        TemplateFixtures fixtures = new TemplateFixtures();
        TemplateLibrary library = fixtures.library();

        assertThat(library.knownNames()).containsExactly("panel", "picker");
        Template panel = library.get("PANEL");
        assertThat(panel.visgroupNames()).containsExactly("", "extra");
        assertThat(panel.visgrouped(Set.of()).world()).containsExactly(fixtures.panel);
        assertThat(panel.visgrouped(Set.of("extra")).world()).containsExactly(fixtures.panel, fixtures.extra);
        assertThat(panel.visgrouped(Set.of()).overlays()).containsExactly(fixtures.overlay);
        assertThat(panel.overlayFaces()).containsExactly(TemplateFixtures.side(fixtures.panel, TemplateFixtures.UP).id());
        assertThat(library.get("panel:extra")).isSameAs(panel);
        assertThat(library.has("Picker")).isTrue();
        assertThat(library.scaling("scale").get(TemplateFixtures.UP)).isPresent();
    }

    @Test
    @DisplayName("Colour pickers keep their placement and faces")
    void colorPickers() {
        TemplateFixtures fixtures = new TemplateFixtures();

        ColorPicker picker = fixtures.library().get("picker").colorPickers().get(0);

        assertThat(picker.name()).isEqualTo("floor_sample");
        assertThat(picker.normal()).isEqualTo(TemplateFixtures.UP);
        assertThat(picker.afterPick()).isEqualTo(AfterPickMode.NODRAW);
        assertThat(picker.faces()).hasSize(6);
        assertThat(picker.visgroup()).isEmpty();

        ColorPicker sealed = fixtures.library().get("picker").colorPickers().get(1);
        assertThat(sealed.visgroup()).isEqualTo("sealed");
        assertThat(sealed.appliesTo(Set.of("", "SEALED"))).isTrue();
        assertThat(sealed.appliesTo(Set.of(""))).isFalse();
        assertThat(fixtures.library().get("picker").visgroupNames()).contains("sealed");
    }

    @Test
    @DisplayName("An unknown name lists every valid template")
    void unknownTemplate() {
        TemplateLibrary library = new TemplateFixtures().library();

        assertThatThrownBy(() -> library.get("missing"))
                .isInstanceOf(InvalidTemplateNameException.class)
                .hasMessage("Template \"missing\" does not exist! Valid templates:\npanel\npicker");
        assertThatThrownBy(() -> library.get("panel").visgrouped(Set.of("nope")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown visgroup \"nope\"");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Template entity .* has no template_id, ignored")
    @DisplayName("Template entities without an id are skipped")
    void missingId() {
        TemplateFixtures fixtures = new TemplateFixtures();
        Entity stray = fixtures.doc.createEntity("bee2_template_world");

        TemplateLibrary library = TemplateLibrary.load(fixtures.doc);

        assertThat(library.knownNames()).containsExactly("panel", "picker");
        assertThat(stray.isRemoved()).isFalse();
    }

    @Test
    @DisplayName("Template names split off requested visgroups")
    void templateNames() {
        assertThat(TemplateName.parse(" Door:Open, Closed ")).isEqualTo(new TemplateName("door", Set.of("open", "closed")));
        assertThat(TemplateName.parse("door").visgroups()).isEmpty();
    }
}
