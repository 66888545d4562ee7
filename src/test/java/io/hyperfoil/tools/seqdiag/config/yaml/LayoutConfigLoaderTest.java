package io.hyperfoil.tools.seqdiag.config.yaml;

import io.hyperfoil.tools.seqdiag.config.LayoutConfig;
import io.hyperfoil.tools.seqdiag.config.LayoutConfigException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class LayoutConfigLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static String join(String...lines){
        return String.join("\n",lines);
    }

    @Test
    public void top_level_keys(){
        LayoutConfig config = new LayoutConfigLoader().load(join(
                "participant-gap: 200",
                "step-spacing: 40.5"
        ));
        assertEquals(200,config.getParticipantGap(),0.0);
        assertEquals(40.5,config.getStepSpacing(),0.0);
        assertEquals("unset keys keep defaults",120,config.getBoxWidth(),0.0);
    }

    @Test
    public void nested_under_layout(){
        LayoutConfig config = new LayoutConfigLoader().load(join(
                "layout:",
                "  box-width: 100"
        ));
        assertEquals(100,config.getBoxWidth(),0.0);
    }

    @Test
    public void empty_is_base(){
        LayoutConfigLoader loader = new LayoutConfigLoader();
        assertSame(LayoutConfig.defaults(),loader.load(""));
        assertSame(LayoutConfig.defaults(),loader.load((String)null));
        assertSame(LayoutConfig.defaults(),loader.load("layout:"));
        assertFalse(loader.hasErrors());
    }

    @Test
    public void applies_on_base(){
        LayoutConfig base = LayoutConfig.defaults().with(LayoutConfig.Key.STEP_SPACING,50);
        LayoutConfig config = new LayoutConfigLoader().load("box-height: 60",base);
        assertEquals(50,config.getStepSpacing(),0.0);
        assertEquals(60,config.getBoxHeight(),0.0);
    }

    @Test
    public void collects_every_error(){
        LayoutConfigLoader loader = new LayoutConfigLoader();
        try{
            loader.load(join(
                    "participant-gap: 200",
                    "gap: 10",
                    "step-spacing: wide",
                    "box-width: -4"
            ));
            fail("invalid entries should throw");
        }catch(LayoutConfigException e){
            assertEquals(3,e.getErrors().size());
            assertTrue(e.getErrors().get(0),e.getErrors().get(0).contains("unknown key gap"));
            assertTrue(e.getErrors().get(1),e.getErrors().get(1).contains("step-spacing"));
            assertTrue(e.getErrors().get(2),e.getErrors().get(2).contains("box-width"));
            assertTrue(e.getMessage(),e.getMessage().startsWith("invalid layout configuration in <string>: "));
        }
        assertTrue(loader.hasErrors());
        assertEquals(5,loader.load("top-margin: 5").getTopMargin(),0.0);
        assertFalse("errors reset on the next load",loader.hasErrors());
    }

    @Test(expected = LayoutConfigException.class)
    public void not_a_mapping(){
        new LayoutConfigLoader().load(join("- a","- b"));
    }

    @Test
    public void invalid_yaml(){
        try{
            new LayoutConfigLoader().load("step-spacing: [1");
            fail("malformed yaml should throw");
        }catch(LayoutConfigException e){
            assertNotNull(e.getCause());
        }
    }

    @Test
    public void from_file() throws IOException {
        Path path = folder.newFile("layout.yaml").toPath();
        Files.write(path,"note-gap: 12\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(12,new LayoutConfigLoader().load(path).getNoteGap(),0.0);
    }

    @Test
    public void from_resource(){
        LayoutConfig config = new LayoutConfigLoader().loadResource("wide-layout.yaml");
        assertEquals(220,config.getParticipantGap(),0.0);
        assertEquals(140,config.getBoxWidth(),0.0);
        assertEquals(37,config.getNoteMaxChars());
    }

    @Test(expected = LayoutConfigException.class)
    public void missing_resource(){
        new LayoutConfigLoader().loadResource("does-not-exist.yaml");
    }
}
