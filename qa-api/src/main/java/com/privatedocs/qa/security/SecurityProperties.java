package com.privatedocs.qa.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "docqa.security")
public class SecurityProperties {

    /**
     * Optional static bearer token used to authenticate requests when configured.
     */
    private String staticToken;

    /**
     * Caller id assigned to requests authenticated with the static token.
     */
    private String staticCallerId = "static-bearer";

    private List<String> staticRoles = new ArrayList<>();

    /**
     * JWT claim that identifies the caller. Documents are owned by this value.
     */
    private String principalClaim = "sub";

    private List<String> staticTags = new ArrayList<>();

    private String rolesClaim = "roles";

    /**
     * JWT claim carrying the caller's group tags, either as an array or a space or comma separated string.
     */
    private String tagsClaim = "tags";

    public String getStaticToken() {
        return staticToken;
    }

    public void setStaticToken(String staticToken) {
        this.staticToken = staticToken;
    }

    public String getStaticCallerId() {
        return staticCallerId;
    }

    public void setStaticCallerId(String staticCallerId) {
        this.staticCallerId = staticCallerId;
    }

    public List<String> getStaticRoles() {
        return staticRoles;
    }

    public void setStaticRoles(List<String> staticRoles) {
        this.staticRoles = staticRoles;
    }

    public List<String> getStaticTags() {
        return staticTags;
    }

    public void setStaticTags(List<String> staticTags) {
        this.staticTags = staticTags;
    }

    public String getPrincipalClaim() {
        return principalClaim;
    }

    public void setPrincipalClaim(String principalClaim) {
        this.principalClaim = principalClaim;
    }

    public String getRolesClaim() {
        return rolesClaim;
    }

    public void setRolesClaim(String rolesClaim) {
        this.rolesClaim = rolesClaim;
    }

    public String getTagsClaim() {
        return tagsClaim;
    }

    public void setTagsClaim(String tagsClaim) {
        this.tagsClaim = tagsClaim;
    }

    public boolean hasStaticToken() {
        return staticToken != null && !staticToken.isBlank();
    }
}
