package io.blog.core.post;

/** User-supplied content of a post, used by add and update. */
public final class PostPayload {
    public final String title;
    public final String body;
    public final String imageURL;

    public PostPayload(String title, String body, String imageURL) {
        this.title = title;
        this.body = body;
        this.imageURL = imageURL;
    }

    /** True when any of the three fields is null or empty. */
    public boolean hasMissingFields() {
        return isEmpty(title) || isEmpty(body) || isEmpty(imageURL);
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
