package com.example.cvmatch.text;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

public final class SkillDictionaryLoader {

    private static final Logger log = LoggerFactory.getLogger(SkillDictionaryLoader.class);

    private SkillDictionaryLoader() {
    }

    public static SkillDictionary load(Resource resource, ObjectMapper mapper) {
        try (InputStream in = resource.getInputStream()) {
            DictionaryDocument doc = mapper.readValue(in, DictionaryDocument.class);
            SkillDictionary dictionary = new SkillDictionary(doc);
            log.info("Loaded skill dictionary version={} skills={} from {}",
                    dictionary.version(), dictionary.skills().size(), resource.getDescription());
            return dictionary;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read skill dictionary from " + resource.getDescription(), e);
        }
    }
}
