package com.metadata.disambiguation.ids;

import com.metadata.disambiguation.core.model.Candidate;
import com.metadata.disambiguation.graph.CandidateRepository;
import com.metadata.disambiguation.schema.SchemaRegistry;
import com.metadata.disambiguation.schema.TargetSchema;

/**
 * Resolves obfuscated ids by decoding them with {@link IdObfuscator} and loading the record.
 */
public class GraphIdResolver implements ObfuscatedIdResolver {

    private final CandidateRepository repository;
    private final SchemaRegistry schemas;

    public GraphIdResolver(CandidateRepository repository, SchemaRegistry schemas) {
        this.repository = repository;
        this.schemas = schemas;
    }

    @Override
    public Candidate resolve(String id) throws InvalidIdException {
        IdObfuscator.DecodedId decoded = IdObfuscator.decode(id);
        TargetSchema schema = schemas.byTypeCode(decoded.typeCode())
                .orElseThrow(() -> new InvalidIdException("Unknown type code in id " + id));
        return repository.findById(schema, decoded.pk())
                .orElseThrow(() -> new InvalidIdException("No " + schema.name() + " with id " + id));
    }
}
