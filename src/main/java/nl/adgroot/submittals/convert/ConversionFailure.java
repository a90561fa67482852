package nl.adgroot.submittals.convert;

public record ConversionFailure(String filename, String reason) {}
