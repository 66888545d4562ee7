package io.hyperfoil.tools.seqdiag.config.yaml;

import io.hyperfoil.tools.seqdiag.config.LayoutConfig;
import io.hyperfoil.tools.seqdiag.config.LayoutConfigException;
import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads {@link LayoutConfig} overrides from yaml.
 * <pre>
 * participant-gap: 200
 * step-spacing: 40
 * </pre>
 * The keys may also sit under a top level <code>layout:</code> entry. Unknown keys and non numeric values are errors.
 */
public class LayoutConfigLoader {

    private static final XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    public static final String ROOT_KEY = "layout";

    private final Yaml yaml;
    private final List<String> errors;

    public LayoutConfigLoader(){
        yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        errors = new LinkedList<>();
    }

    public boolean hasErrors(){
        return !errors.isEmpty();
    }
    public List<String> getErrors(){
        return Collections.unmodifiableList(errors);
    }

    public LayoutConfig load(String content){
        return load(content,LayoutConfig.defaults());
    }

    public LayoutConfig load(Path path){
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)){
            return load(reader,LayoutConfig.defaults(),path.toString());
        } catch (IOException e) {
            throw new LayoutConfigException("failed to read "+path,e);
        }
    }

    public LayoutConfig loadResource(String resourceName){
        InputStream stream = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName);
        if(stream == null){
            throw new LayoutConfigException("missing resource "+resourceName);
        }
        try (Reader reader = new InputStreamReader(stream,StandardCharsets.UTF_8)){
            return load(reader,LayoutConfig.defaults(),resourceName);
        } catch (IOException e) {
            throw new LayoutConfigException("failed to read "+resourceName,e);
        }
    }

    /**
     * Applies the overrides in <code>content</code> on top of <code>base</code>.
     * @throws LayoutConfigException listing every invalid entry
     */
    public LayoutConfig load(String content, LayoutConfig base){
        return load(new StringReader(content == null ? "" : content),base,"<string>");
    }

    private LayoutConfig load(Reader reader, LayoutConfig base, String source){
        errors.clear();
        Object loaded;
        try {
            loaded = yaml.load(reader);
        }catch (YAMLException e){
            throw new LayoutConfigException("invalid yaml in "+source,e);
        }
        if(loaded == null){
            logger.debug("{} is empty, using {}",source,base);
            return base;
        }
        if(!(loaded instanceof Map)){
            throw new LayoutConfigException("expected a mapping in "+source+" but found "+loaded.getClass().getSimpleName());
        }
        Map<?,?> map = (Map<?,?>) loaded;
        if(map.size() == 1 && map.containsKey(ROOT_KEY)){
            Object nested = map.get(ROOT_KEY);
            if(nested == null){
                return base;
            }
            if(!(nested instanceof Map)){
                throw new LayoutConfigException("expected "+ROOT_KEY+" to be a mapping in "+source);
            }
            map = (Map<?,?>) nested;
        }
        LayoutConfig rtrn = base;
        for(Map.Entry<?,?> entry : map.entrySet()){
            String name = String.valueOf(entry.getKey());
            LayoutConfig.Key key = LayoutConfig.Key.fromName(name);
            if(key == null){
                errors.add("unknown key "+name);
                continue;
            }
            Object value = entry.getValue();
            if(!(value instanceof Number)){
                errors.add(name+" must be a number but was "+value);
                continue;
            }
            double number = ((Number)value).doubleValue();
            if(Double.isNaN(number) || Double.isInfinite(number) || number < 0){
                errors.add(name+" must be a finite number >= 0 but was "+value);
                continue;
            }
            rtrn = rtrn.with(key,number);
        }
        if(hasErrors()){
            throw new LayoutConfigException("invalid layout configuration in "+source,new ArrayList<>(errors));
        }
        logger.debug("loaded {} overrides from {}",map.size(),source);
        return rtrn;
    }
}
