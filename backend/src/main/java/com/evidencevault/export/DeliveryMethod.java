package com.evidencevault.export;

public enum DeliveryMethod {
    SECURE_DOWNLOAD,
    ENCRYPTED_EMAIL,
    PHYSICAL_MEDIA
}
