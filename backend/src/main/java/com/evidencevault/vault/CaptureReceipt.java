package com.evidencevault.vault;

public record CaptureReceipt(String vaultId, String evidenceId) {}
