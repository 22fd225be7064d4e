package com.brixo.tronbyt.device.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Información que reporta el propio dispositivo (firmware, protocolo, MAC).
 * protocolVersion queda en null hasta que el firmware envía su primer
 * "queued" o "displaying".
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class DeviceInfo {

    private String firmwareVersion;
    private String firmwareType;
    private Integer protocolVersion;
    private String macAddress;
    private ProtocolType protocolType;

    public String getFirmwareVersion() {
        return firmwareVersion;
    }

    public void setFirmwareVersion(String firmwareVersion) {
        this.firmwareVersion = firmwareVersion;
    }

    public String getFirmwareType() {
        return firmwareType;
    }

    public void setFirmwareType(String firmwareType) {
        this.firmwareType = firmwareType;
    }

    public Integer getProtocolVersion() {
        return protocolVersion;
    }

    public void setProtocolVersion(Integer protocolVersion) {
        this.protocolVersion = protocolVersion;
    }

    public String getMacAddress() {
        return macAddress;
    }

    public void setMacAddress(String macAddress) {
        this.macAddress = macAddress;
    }

    public ProtocolType getProtocolType() {
        return protocolType;
    }

    public void setProtocolType(ProtocolType protocolType) {
        this.protocolType = protocolType;
    }
}
