package com.williamcallahan.ratchet.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Versioned attribute bag persisted with every message.
 *
 * <p>The {@code schema_version} property selects the variant. Rows written before versioning existed
 * carry no discriminator and read as {@link MessageAttributesV1}.</p>
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.PROPERTY,
        property = "schema_version",
        defaultImpl = MessageAttributesV1.class)
@JsonSubTypes(@JsonSubTypes.Type(value = MessageAttributesV1.class, name = "1"))
public sealed interface MessageAttributes permits MessageAttributesV1 {

    /**
     * Returns this bag upgraded to the newest schema version.
     */
    MessageAttributesV1 latest();
}
