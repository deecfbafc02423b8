package dev.pekelund.shop.address;

/**
 * Address fields supplied by the owner when creating an address.
 */
public record AddressDraft(
    String label,
    String street,
    String city,
    String region,
    String postalCode,
    String country,
    Double latitude,
    Double longitude
) {

    public AddressDraft(String label, String street, String city, String region, String postalCode,
                        String country) {
        this(label, street, city, region, postalCode, country, null, null);
    }
}
