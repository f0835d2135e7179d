package com.paramguard.validation.source;

import java.util.List;

import com.paramguard.validation.ResolvedType;

/**
 * Uploaded file part. Handles are passed through as received; the request owns them.
 */
public class FileBinding extends AbstractSourceBinding {

    public FileBinding() {
        this(Constraints.none());
    }

    public FileBinding(final Constraints constraints) {
        super(null, constraints);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.FILE;
    }

    @Override
    public Object convert(final Object rawValue, final ResolvedType type) {
        if (type.list() && rawValue instanceof UploadedFile) {
            return List.of(rawValue);
        }
        return rawValue;
    }
}
