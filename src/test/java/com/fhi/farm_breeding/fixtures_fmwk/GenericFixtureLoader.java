package com.fhi.farm_breeding.fixtures_fmwk;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.springframework.context.ApplicationContext;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.support.Repositories;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads a JSON list of entities and saves it through the entity's repository.
 */
@Slf4j
public class GenericFixtureLoader
{
    private final ObjectMapper objectMapper;
    private final Repositories repositories;

    public GenericFixtureLoader(ObjectMapper objectMapper, ApplicationContext context)
    {   this.objectMapper = objectMapper;
        this.repositories = new Repositories(context);
    }


    @Transactional
    public <T> void load(Class<T> entityClass, String testClassSimpleName)
    {
        String fileName = entityClass.getSimpleName().toLowerCase() + "s.json";  // e.g. AnimalType -> animaltypes.json

        List<String> candidatePaths = List.of(
                "fixtures/tests/" + testClassSimpleName + "/" + fileName,
                "fixtures/shared/" + fileName
        );

        for (String path : candidatePaths)
        {
            ClassPathResource resource = new ClassPathResource(path);
            if (!resource.exists())
            {   log.debug("No fixture at {}, trying next one", path);
                continue;
            }
            try (InputStream is = resource.getInputStream())
            {   List<T> entities = deserializeList(is, entityClass);
                getRepository(entityClass).saveAll(entities);
                log.info("Loaded {} entities of type {} from {}", entities.size(), entityClass.getSimpleName(), path);
                return;
            }
            catch (IOException e)
            {   throw new IllegalStateException("Unreadable fixture " + path, e);
            }
        }

        throw new IllegalStateException("No fixture file found for entity: " + entityClass.getSimpleName()
                                        + " (looked in: " + candidatePaths + ")");
    }


    @SuppressWarnings("unchecked")
    private <T> CrudRepository<T, ?> getRepository(Class<T> entityClass)
    {   return (CrudRepository<T, ?>) repositories.getRepositoryFor(entityClass)
                                                  .orElseThrow(() -> new IllegalArgumentException("No repository found for " + entityClass.getName()));
    }

    private <T> List<T> deserializeList(InputStream is, Class<T> clazz) throws IOException
    {   JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, clazz);
        return objectMapper.readValue(is, listType);
    }
}
