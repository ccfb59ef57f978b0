package org.janelia.spatialnorm.exceptions;

import org.janelia.spatialnorm.common.ComputationException;

public class MissingDataException extends ComputationException {

    public MissingDataException(String msg) {
        super(msg);
    }

    public MissingDataException(String msg, Throwable e) {
        super(msg, e);
    }

}
