package com.example.audiobook.adapters;

import com.example.audiobook.exception.LicenseException;
import com.example.audiobook.utils.model.License;

/**
 * Hands out the download url and decryption material of an item.
 */
public interface LicenseProvider {
    License obtainLicense(String itemId, String quality) throws LicenseException;
}
