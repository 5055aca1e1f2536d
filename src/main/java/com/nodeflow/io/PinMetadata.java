package com.nodeflow.io;

import com.nodeflow.api.PinDirection;
import com.nodeflow.model.Pin;

/** Static description of one pin of a registered node type. */
public record PinMetadata(String name, PinDirection direction, Class<?> dataType, boolean flowPin) {

    public static PinMetadata of(Pin pin) {
        return new PinMetadata(pin.getName(), pin.getDirection(), pin.getDataType(), pin.isFlowPin());
    }
}
