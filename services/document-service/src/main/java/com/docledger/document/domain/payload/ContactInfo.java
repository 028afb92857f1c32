package com.docledger.document.domain.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContactInfo implements PayloadSection {

    @NotBlank(groups = CompletionChecks.class, message = "business name is required")
    @Size(max = 255)
    private String businessName;

    @Size(max = 255)
    private String contactPerson;

    @Email
    @Size(max = 255)
    private String email;

    @Size(max = 50)
    @Pattern(regexp = "^[+0-9 ()./-]*$", message = "phone may only contain digits, spaces and + ( ) . / -")
    private String phone;

    @Size(max = 500)
    @Pattern(regexp = "^(https?://).+", message = "website must be an http(s) URL")
    private String website;

    private Map<String, @Size(max = 500) String> socialMedia;

    @Override
    public SectionType sectionType() {
        return SectionType.CONTACT_INFO;
    }
}
