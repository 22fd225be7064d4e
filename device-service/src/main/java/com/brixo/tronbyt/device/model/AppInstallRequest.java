package com.brixo.tronbyt.device.model;

import java.util.Map;

public record AppInstallRequest(String name, String path, Integer uinterval, Integer displayTime,
        Boolean enabled, String notes, Map<String, Object> config) {
}
